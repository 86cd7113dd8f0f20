package com.tony.matchPredictor.repository;

import com.tony.matchPredictor.config.ClockConfig;
import com.tony.matchPredictor.exception.InvalidSignalException;
import com.tony.matchPredictor.model.ABConfig;
import com.tony.matchPredictor.model.Bucket;
import com.tony.matchPredictor.model.BookmakerOddsQuote;
import com.tony.matchPredictor.model.CalibrationEvent;
import com.tony.matchPredictor.model.MatchOutcome;
import com.tony.matchPredictor.service.OddsQuoteService;
import com.tony.matchPredictor.service.TrafficSplitterService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({OddsQuoteService.class, TrafficSplitterService.class, ClockConfig.class})
class PersistenceRulesTest {

    private static final Instant T0 = Instant.parse("2026-03-14T15:00:00Z");

    @Autowired
    private OddsQuoteService quoteService;
    @Autowired
    private TrafficSplitterService trafficSplitter;
    @Autowired
    private BookmakerOddsQuoteRepository quoteRepository;
    @Autowired
    private ABAssignmentRepository assignmentRepository;
    @Autowired
    private CalibrationEventRepository eventRepository;
    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("Une cote plus récente remplace l'ancienne, une plus ancienne est ignorée")
    void newerQuoteSupersedesOlder() {
        quoteService.upsert(quote("2.10", T0));
        quoteService.upsert(quote("2.25", T0.plusSeconds(60)));
        quoteService.upsert(quote("1.80", T0.plusSeconds(30)));
        entityManager.flush();
        entityManager.clear();

        assertThat(quoteRepository.findByFixtureId(1L)).singleElement()
                .satisfies(q -> {
                    assertThat(q.getOdds()).isEqualByComparingTo("2.25");
                    assertThat(q.getQuotedAt()).isEqualTo(T0.plusSeconds(60));
                });
    }

    @Test
    @DisplayName("Un identifiant fourni avec une nouvelle cote n'écrase pas une autre ligne")
    void incomingIdNeverOverwritesAnotherQuote() {
        BookmakerOddsQuote stored = quoteService.upsert(quote("2.10", T0));
        entityManager.flush();
        entityManager.clear();

        BookmakerOddsQuote otherFixture = quote("3.40", T0.plusSeconds(60));
        otherFixture.setFixtureId(2L);
        otherFixture.setId(stored.getId());
        quoteService.upsert(otherFixture);
        entityManager.flush();
        entityManager.clear();

        assertThat(quoteRepository.count()).isEqualTo(2);
        assertThat(quoteRepository.findByFixtureId(1L)).singleElement()
                .satisfies(q -> assertThat(q.getOdds()).isEqualByComparingTo("2.10"));
        assertThat(quoteRepository.findByFixtureId(2L)).singleElement()
                .satisfies(q -> {
                    assertThat(q.getOdds()).isEqualByComparingTo("3.40");
                    assertThat(q.getId()).isNotEqualTo(stored.getId());
                });
    }

    @Test
    @DisplayName("Une cote <= 1.0 est refusée")
    void oddsMustBeAboveOne() {
        assertThatThrownBy(() -> quoteService.upsert(quote("1.00", T0))).isInstanceOf(InvalidSignalException.class);
    }

    @Test
    @DisplayName("Affectation A/B persistée une fois, puis relue telle quelle")
    void assignmentIsStickyInStorage() {
        Bucket first = trafficSplitter.assign("device-sticky", new ABConfig(0, 7L));
        Bucket second = trafficSplitter.assign("device-sticky", new ABConfig(100, 7L));

        assertThat(first).isEqualTo(Bucket.A);
        assertThat(second).isEqualTo(Bucket.A);
        assertThat(assignmentRepository.count()).isEqualTo(1);

        trafficSplitter.clearAssignment("device-sticky");
        entityManager.flush();
        entityManager.clear();
        assertThat(trafficSplitter.assign("device-sticky", new ABConfig(100, 7L))).isEqualTo(Bucket.B);
    }

    @Test
    @DisplayName("Fenêtre d'événements semi-ouverte [from, to[")
    void calibrationWindowIsHalfOpen() {
        eventRepository.save(event(1L, T0));
        eventRepository.save(event(2L, T0.plusSeconds(3600)));
        entityManager.flush();

        assertThat(eventRepository.findInWindow(1L, T0, T0.plusSeconds(3600)))
                .extracting(CalibrationEvent::getFixtureId)
                .containsExactly(1L);
        assertThat(eventRepository.existsByFixtureIdAndModelVersionId(2L, 1L)).isTrue();
    }

    private static BookmakerOddsQuote quote(String odds, Instant at) {
        return BookmakerOddsQuote.builder()
                .fixtureId(1L)
                .bookmaker("Betclic")
                .marketCode("1X2")
                .outcome("H")
                .odds(new BigDecimal(odds))
                .quotedAt(at)
                .build();
    }

    private static CalibrationEvent event(Long fixtureId, Instant at) {
        return CalibrationEvent.builder()
                .fixtureId(fixtureId)
                .modelVersionId(1L)
                .pHome(0.5).pDraw(0.3).pAway(0.2)
                .outcome(MatchOutcome.H)
                .createdAt(at)
                .build();
    }
}
