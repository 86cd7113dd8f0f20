package com.tony.matchPredictor.repository;

import com.tony.matchPredictor.model.BookmakerOddsQuote;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface BookmakerOddsQuoteRepository extends JpaRepository<BookmakerOddsQuote, Long> {

    Optional<BookmakerOddsQuote> findByFixtureIdAndBookmakerAndMarketCodeAndOutcome(
            Long fixtureId, String bookmaker, String marketCode, String outcome);

    List<BookmakerOddsQuote> findByFixtureId(Long fixtureId);

    List<BookmakerOddsQuote> findByFixtureIdAndMarketCode(Long fixtureId, String marketCode);

    // Cotes potentiellement encore fraîches (le filtre exact est fait en mémoire)
    List<BookmakerOddsQuote> findByQuotedAtAfter(Instant since);
}
