package com.dinoventures.economy.controller;

import com.dinoventures.economy.model.Currency;
import com.dinoventures.economy.model.ExchangeRate;
import com.dinoventures.economy.model.dto.CreateCurrencyRequest;
import com.dinoventures.economy.model.dto.ExchangeRateRequest;
import com.dinoventures.economy.model.dto.PrimaryCurrencyRequest;
import com.dinoventures.economy.service.CurrencyRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/groups/{groupId}")
@RequiredArgsConstructor
public class CurrencyController {

    private final CurrencyRegistry currencyRegistry;

    /**
     * POST /api/v1/groups/{groupId}/currencies
     * The first currency of a group becomes its primary currency.
     */
    @PostMapping("/currencies")
    public ResponseEntity<Currency> createCurrency(@PathVariable long groupId,
                                                   @Valid @RequestBody CreateCurrencyRequest req) {
        Currency currency = currencyRegistry.createCurrency(groupId, req.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(currency);
    }

    @GetMapping("/currencies")
    public ResponseEntity<List<Currency>> listCurrencies(@PathVariable long groupId) {
        return ResponseEntity.ok(currencyRegistry.currenciesOf(groupId));
    }

    /**
     * PUT /api/v1/groups/{groupId}/primary-currency
     */
    @PutMapping("/primary-currency")
    public ResponseEntity<Currency> setPrimary(@PathVariable long groupId,
                                               @Valid @RequestBody PrimaryCurrencyRequest req) {
        return ResponseEntity.ok(currencyRegistry.setPrimaryCurrency(groupId, req.getCurrencyId()));
    }

    /**
     * PUT /api/v1/groups/{groupId}/exchange-rates
     * Creates or replaces one directional rate. The reverse direction is not implied.
     */
    @PutMapping("/exchange-rates")
    public ResponseEntity<ExchangeRate> setRate(@PathVariable long groupId,
                                                @Valid @RequestBody ExchangeRateRequest req) {
        ExchangeRate rate = currencyRegistry.setExchangeRate(
                groupId, req.getBaseCurrencyId(), req.getQuoteCurrencyId(), req.getRate());
        return ResponseEntity.ok(rate);
    }

    /**
     * DELETE /api/v1/groups/{groupId}/exchange-rates?base_currency_id=1&amp;quote_currency_id=2
     */
    @DeleteMapping("/exchange-rates")
    public ResponseEntity<Void> removeRate(@PathVariable long groupId,
                                           @RequestParam("base_currency_id") long baseCurrencyId,
                                           @RequestParam("quote_currency_id") long quoteCurrencyId) {
        currencyRegistry.removeExchangeRate(groupId, baseCurrencyId, quoteCurrencyId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/exchange-rates")
    public ResponseEntity<List<ExchangeRate>> listRates(@PathVariable long groupId) {
        return ResponseEntity.ok(currencyRegistry.ratesOf(groupId));
    }
}
