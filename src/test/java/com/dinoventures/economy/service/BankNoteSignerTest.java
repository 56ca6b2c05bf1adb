package com.dinoventures.economy.service;

import com.dinoventures.economy.exception.InvalidSignatureException;
import com.dinoventures.economy.model.NoteClaims;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BankNoteSignerTest {

    private static final String SECRET       = "test-secret-test-secret-test-secret-0001";
    private static final String OTHER_SECRET = "another-secret-another-secret-another-02";

    private final BankNoteSigner signer = new BankNoteSigner(SECRET);

    private final NoteClaims claims = new NoteClaims(UUID.randomUUID(), 3L, 500L, "user-bob");

    @Test
    void verify_returnsTheSignedClaims() {
        String token = signer.sign(claims);

        assertThat(token.split("\\.")).hasSize(3);
        assertThat(signer.verify(token)).isEqualTo(claims);
    }

    @Test
    void header_declaresJwtHs256() {
        String header = decodeSegment(signer.sign(claims).split("\\.")[0]);

        assertThat(header).contains("\"typ\":\"JWT\"").contains("\"alg\":\"HS256\"");
    }

    @Test
    void verify_rejectsTokenSignedWithAnotherSecret() {
        String forged = new BankNoteSigner(OTHER_SECRET).sign(claims);

        assertThatThrownBy(() -> signer.verify(forged))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    void verify_rejectsEditedAmount() {
        String[] parts = signer.sign(claims).split("\\.");
        String payload = decodeSegment(parts[1]);
        assertThat(payload).contains("\"amount\":500");

        String inflated = parts[0] + "." + encodeSegment(payload.replace("\"amount\":500", "\"amount\":900")) + "." + parts[2];

        assertThatThrownBy(() -> signer.verify(inflated))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    void verify_rejectsEditedRecipient() {
        String[] parts = signer.sign(claims).split("\\.");
        String payload = decodeSegment(parts[1]).replace("user-bob", "user-eve");
        String redirected = parts[0] + "." + encodeSegment(payload) + "." + parts[2];

        assertThatThrownBy(() -> signer.verify(redirected))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    void verify_rejectsAnySingleBitFlipInPayload() {
        String[] parts = signer.sign(claims).split("\\.");
        byte[] payload = Base64.getUrlDecoder().decode(parts[1]);

        for (int i = 0; i < payload.length; i++) {
            for (int bit = 0; bit < 8; bit++) {
                byte[] flipped = payload.clone();
                flipped[i] ^= (byte) (1 << bit);
                String token = parts[0] + "." + Base64.getUrlEncoder().withoutPadding().encodeToString(flipped) + "." + parts[2];

                assertThatThrownBy(() -> signer.verify(token))
                        .as("flip of bit %d in payload byte %d", bit, i)
                        .isInstanceOf(InvalidSignatureException.class);
            }
        }
    }

    @Test
    void verify_rejectsUnsignedToken() {
        String[] parts = signer.sign(claims).split("\\.");
        String unsigned = encodeSegment("{\"alg\":\"none\"}") + "." + parts[1] + ".";

        assertThatThrownBy(() -> signer.verify(unsigned))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    void verify_rejectsGarbage() {
        assertThatThrownBy(() -> signer.verify("not-a-token")).isInstanceOf(InvalidSignatureException.class);
        assertThatThrownBy(() -> signer.verify("")).isInstanceOf(InvalidSignatureException.class);
        assertThatThrownBy(() -> signer.verify(null)).isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    void constructor_rejectsShortSecret() {
        assertThatThrownBy(() -> new BankNoteSigner("too-short"))
                .isInstanceOf(IllegalStateException.class);
    }

    private static String decodeSegment(String segment) {
        return new String(Base64.getUrlDecoder().decode(segment), StandardCharsets.UTF_8);
    }

    private static String encodeSegment(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }
}
