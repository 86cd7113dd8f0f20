package com.tony.matchPredictor.service;

import com.tony.matchPredictor.exception.InvalidSignalException;
import com.tony.matchPredictor.model.BookmakerOddsQuote;
import com.tony.matchPredictor.repository.BookmakerOddsQuoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Point d'écriture des cotes reçues de l'ingestion : une seule ligne par (match, bookmaker, marché, issue).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OddsQuoteService {

    private final BookmakerOddsQuoteRepository quoteRepository;

    /**
     * Remplace la cote stockée seulement si la nouvelle est plus récente.
     */
    @Transactional
    public BookmakerOddsQuote upsert(BookmakerOddsQuote quote) {
        validate(quote);

        Optional<BookmakerOddsQuote> existing = quoteRepository.findByFixtureIdAndBookmakerAndMarketCodeAndOutcome(
                quote.getFixtureId(), quote.getBookmaker(), quote.getMarketCode(), quote.getOutcome());

        if (existing.isEmpty()) {
            // Nouvelle ligne : l'identifiant reçu n'est jamais repris
            return quoteRepository.save(BookmakerOddsQuote.builder()
                    .fixtureId(quote.getFixtureId())
                    .bookmaker(quote.getBookmaker())
                    .marketCode(quote.getMarketCode())
                    .outcome(quote.getOutcome())
                    .odds(quote.getOdds())
                    .quotedAt(quote.getQuotedAt())
                    .build());
        }

        BookmakerOddsQuote current = existing.get();
        if (!quote.getQuotedAt().isAfter(current.getQuotedAt())) {
            log.debug("Cote ignorée (pas plus récente) : {} {} {} {}", quote.getFixtureId(), quote.getBookmaker(),
                    quote.getMarketCode(), quote.getOutcome());
            return current;
        }
        current.setOdds(quote.getOdds());
        current.setQuotedAt(quote.getQuotedAt());
        return quoteRepository.save(current);
    }

    private void validate(BookmakerOddsQuote quote) {
        if (quote.getFixtureId() == null || quote.getBookmaker() == null
                || quote.getMarketCode() == null || quote.getOutcome() == null || quote.getQuotedAt() == null) {
            throw new InvalidSignalException("Cote incomplète : match, bookmaker, marché, issue et horodatage requis");
        }
        if (quote.getOdds() == null || quote.getOdds().compareTo(BigDecimal.ONE) <= 0) {
            throw new InvalidSignalException("Cote décimale invalide (doit être > 1.0) : " + quote.getOdds());
        }
    }
}
