package com.dinoventures.economy.controller;

import com.dinoventures.economy.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full-stack tests: HTTP → Controller → Service → PostgreSQL (Testcontainers).
 *
 * Each test starts with guild "guild-1" onboarded and a Gold currency in its single
 * group. Users are created on first use.
 */
class EconomyApiIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private long groupId;
    private long gold;

    @BeforeEach
    void setUp() {
        assertThat(post("/api/v1/guilds", Map.of("guild_id", "guild-1")).getStatusCode()).isEqualTo(HttpStatus.OK);
        groupId = singleGroupOf("guild-1");
        gold = createCurrency(groupId, "Gold");
    }

    // =========================================================================
    // Helper methods
    // =========================================================================

    private ResponseEntity<Map> post(String path, Map<String, Object> body) {
        return send(HttpMethod.POST, path, body);
    }

    private ResponseEntity<Map> send(HttpMethod method, String path, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.exchange(path, method, new HttpEntity<>(body, headers), Map.class);
    }

    private long singleGroupOf(String guildId) {
        ResponseEntity<List> resp = restTemplate.getForEntity("/api/v1/guilds/{id}/groups", List.class, guildId);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        return ((List<Map<String, Object>>) resp.getBody()).stream()
                .filter(m -> "SINGLE".equals(m.get("group_kind")))
                .map(m -> ((Number) m.get("group_id")).longValue())
                .findFirst()
                .orElseThrow();
    }

    private long createCurrency(long group, String name) {
        ResponseEntity<Map> resp = post("/api/v1/groups/" + group + "/currencies", Map.of("name", name));
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return ((Number) resp.getBody().get("id")).longValue();
    }

    private void mint(String userId, long currencyId, long amount) {
        ResponseEntity<Map> resp = post("/api/v1/economy/mint",
                Map.of("user_id", userId, "currency_id", currencyId, "amount", amount));
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    private long balance(String userId, long currencyId) {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/users/{id}/balances", Map.class, userId);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<Map<String, Object>> balances = (List<Map<String, Object>>) resp.getBody().get("balances");
        return balances.stream()
                .filter(b -> ((Number) b.get("currency_id")).longValue() == currencyId)
                .map(b -> ((Number) b.get("balance")).longValue())
                .findFirst()
                .orElse(0L);
    }

    // =========================================================================
    // Health and onboarding
    // =========================================================================

    @Test
    void health_returnsOk() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/health", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("status")).isEqualTo("ok");
    }

    @Test
    void onboarding_isIdempotent() {
        ResponseEntity<Map> again = post("/api/v1/guilds", Map.of("guild_id", "guild-1"));

        assertThat(again.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(singleGroupOf("guild-1")).isEqualTo(groupId);
    }

    @Test
    void firstCurrencyIsPrimary() {
        ResponseEntity<List> resp = restTemplate.getForEntity("/api/v1/groups/{id}/currencies", List.class, groupId);

        Map<String, Object> currency = (Map<String, Object>) resp.getBody().get(0);
        assertThat(currency.get("name")).isEqualTo("Gold");
        assertThat(currency.get("primary")).isEqualTo(true);
    }

    @Test
    void duplicateCurrency_returns409() {
        ResponseEntity<Map> resp = post("/api/v1/groups/" + groupId + "/currencies", Map.of("name", "Gold"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(resp.getBody().get("error")).isEqualTo("DUPLICATE_CURRENCY");
    }

    @Test
    void leavingSingleGroup_returns409() {
        ResponseEntity<Map> resp = send(HttpMethod.DELETE, "/api/v1/groups/" + groupId + "/members/guild-1", null);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    // =========================================================================
    // Transfers
    // =========================================================================

    @Test
    void transfer_movesBalance() {
        mint("user-alice", gold, 500);

        ResponseEntity<Map> resp = post("/api/v1/economy/transfer", Map.of(
                "from_user_id", "user-alice", "to_user_id", "user-bob", "currency_id", gold, "amount", 200));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((Number) resp.getBody().get("from_balance")).longValue()).isEqualTo(300);
        assertThat(((Number) resp.getBody().get("to_balance")).longValue()).isEqualTo(200);
        assertThat(balance("user-bob", gold)).isEqualTo(200);
    }

    @Test
    void transfer_insufficientBalance_returns422() {
        mint("user-alice", gold, 100);

        ResponseEntity<Map> resp = post("/api/v1/economy/transfer", Map.of(
                "from_user_id", "user-alice", "to_user_id", "user-bob", "currency_id", gold, "amount", 101));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("error")).isEqualTo("INSUFFICIENT_BALANCE");
        assertThat(balance("user-alice", gold)).isEqualTo(100);
    }

    @Test
    void transfer_toSelf_returns422() {
        mint("user-alice", gold, 100);

        ResponseEntity<Map> resp = post("/api/v1/economy/transfer", Map.of(
                "from_user_id", "user-alice", "to_user_id", "user-alice", "currency_id", gold, "amount", 1));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("error")).isEqualTo("SELF_TRANSFER");
    }

    @Test
    void transfer_zeroAmount_returns400WithFieldDetails() {
        ResponseEntity<Map> resp = post("/api/v1/economy/transfer", Map.of(
                "from_user_id", "user-alice", "to_user_id", "user-bob", "currency_id", gold, "amount", 0));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat((Map<String, Object>) resp.getBody().get("details")).containsKey("amount");
    }

    @Test
    void mint_unknownCurrency_returns404() {
        ResponseEntity<Map> resp = post("/api/v1/economy/mint",
                Map.of("user_id", "user-alice", "currency_id", 9999, "amount", 5));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody().get("error")).isEqualTo("CURRENCY_NOT_FOUND");
    }

    @Test
    void balances_ofUnknownUserAreEmpty() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/users/{id}/balances", Map.class, "user-nobody");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((List<?>) resp.getBody().get("balances")).isEmpty();
    }

    // =========================================================================
    // Exchange
    // =========================================================================

    @Test
    void exchange_usesConfiguredDirectionOnly() {
        long gems = createCurrency(groupId, "Gems");
        ResponseEntity<Map> rate = send(HttpMethod.PUT, "/api/v1/groups/" + groupId + "/exchange-rates",
                Map.of("base_currency_id", gold, "quote_currency_id", gems, "rate", "1.5"));
        assertThat(rate.getStatusCode()).isEqualTo(HttpStatus.OK);
        mint("user-alice", gold, 10);

        ResponseEntity<Map> resp = post("/api/v1/economy/exchange", Map.of(
                "user_id", "user-alice", "from_currency_id", gold, "to_currency_id", gems, "amount", 3));
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((Number) resp.getBody().get("credited")).longValue()).isEqualTo(4);

        ResponseEntity<Map> reverse = post("/api/v1/economy/exchange", Map.of(
                "user_id", "user-alice", "from_currency_id", gems, "to_currency_id", gold, "amount", 1));
        assertThat(reverse.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(reverse.getBody().get("error")).isEqualTo("RATE_NOT_FOUND");

        assertThat(balance("user-alice", gold)).isEqualTo(7);
        assertThat(balance("user-alice", gems)).isEqualTo(4);
    }

    @Test
    void nonPositiveRate_returns400() {
        long gems = createCurrency(groupId, "Gems");

        ResponseEntity<Map> resp = send(HttpMethod.PUT, "/api/v1/groups/" + groupId + "/exchange-rates",
                Map.of("base_currency_id", gold, "quote_currency_id", gems, "rate", "0"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void rateWithTooManyDecimals_returns400() {
        long gems = createCurrency(groupId, "Gems");

        ResponseEntity<Map> resp = send(HttpMethod.PUT, "/api/v1/groups/" + groupId + "/exchange-rates",
                Map.of("base_currency_id", gold, "quote_currency_id", gems, "rate", "0.0000000000001"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().get("error")).isEqualTo("VALIDATION_FAILED");
    }

    // =========================================================================
    // Bank notes
    // =========================================================================

    @Test
    void bankNote_lifecycle() {
        mint("user-alice", gold, 300);

        ResponseEntity<Map> issued = post("/api/v1/notes", Map.of(
                "issuer_user_id", "user-alice", "recipient_user_id", "user-bob", "currency_id", gold, "amount", 120));
        assertThat(issued.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        String token = (String) issued.getBody().get("token");
        String noteId = (String) issued.getBody().get("note_id");
        assertThat(balance("user-alice", gold)).isEqualTo(180);

        ResponseEntity<Map> stolen = post("/api/v1/notes/redeem", Map.of("user_id", "user-eve", "token", token));
        assertThat(stolen.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(stolen.getBody().get("error")).isEqualTo("RECIPIENT_MISMATCH");

        ResponseEntity<Map> redeemed = post("/api/v1/notes/redeem", Map.of("user_id", "user-bob", "token", token));
        assertThat(redeemed.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((Number) redeemed.getBody().get("credited")).longValue()).isEqualTo(120);
        assertThat(balance("user-bob", gold)).isEqualTo(120);

        ResponseEntity<Map> again = post("/api/v1/notes/redeem", Map.of("user_id", "user-bob", "token", token));
        assertThat(again.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(again.getBody().get("error")).isEqualTo("ALREADY_CONSUMED");

        ResponseEntity<Map> note = restTemplate.getForEntity("/api/v1/notes/{id}", Map.class, noteId);
        assertThat(note.getBody().get("consumed")).isEqualTo(true);
    }

    @Test
    void bankNote_garbageToken_returns400() {
        ResponseEntity<Map> resp = post("/api/v1/notes/redeem", Map.of("user_id", "user-bob", "token", "a.b.c"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().get("error")).isEqualTo("INVALID_SIGNATURE");
    }

    // =========================================================================
    // Leaderboard and audit
    // =========================================================================

    @Test
    void leaderboard_ranksByBalanceThenSeniority() {
        mint("user-alice", gold, 5);
        mint("user-bob", gold, 20);
        mint("user-carol", gold, 20);
        mint("user-dave", gold, 1);

        ResponseEntity<Map> resp = restTemplate.getForEntity(
                "/api/v1/groups/{id}/leaderboard?limit=3", Map.class, groupId);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<Map<String, Object>> entries = (List<Map<String, Object>>) resp.getBody().get("entries");
        assertThat(entries).extracting(e -> e.get("external_id"))
                .containsExactly("user-bob", "user-carol", "user-alice");
    }

    @Test
    void audit_showsFlushedEvents() {
        mint("user-alice", gold, 5);
        auditQueue.drain(100);

        ResponseEntity<List> resp = restTemplate.getForEntity("/api/v1/users/{id}/audit", List.class, "user-alice");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).hasSize(1);
        assertThat(((Map<String, Object>) resp.getBody().get(0)).get("kind")).isEqualTo("MINT");
    }
}
