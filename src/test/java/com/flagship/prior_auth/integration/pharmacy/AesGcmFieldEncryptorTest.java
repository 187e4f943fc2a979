package com.flagship.prior_auth.integration.pharmacy;

import com.flagship.prior_auth.error.ConfigurationException;
import com.flagship.prior_auth.integration.WireProtocolException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class AesGcmFieldEncryptorTest {

    static final String ENCRYPTION_KEY = base64("0123456789abcdef0123456789abcdef");
    static final String INTEGRITY_KEY = base64("integrity-key-integrity-key-0123");

    private static String base64(String raw) {
        return Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    private final AesGcmFieldEncryptor encryptor = new AesGcmFieldEncryptor(ENCRYPTION_KEY, INTEGRITY_KEY);

    @Test
    @DisplayName("Encrypted fields decrypt back to the plaintext")
    void decryptsWhatItEncrypts() {
        EncryptedField field = encryptor.encrypt("Rivera, Jordan");

        assertEquals(AesGcmFieldEncryptor.ALGORITHM, field.getAlgorithm());
        assertFalse(field.getCiphertext().contains("Rivera"));
        assertEquals("Rivera, Jordan", encryptor.decrypt(field));
    }

    @Test
    @DisplayName("Each encryption uses a fresh IV")
    void freshIvPerField() {
        EncryptedField first = encryptor.encrypt("M987654321");
        EncryptedField second = encryptor.encrypt("M987654321");

        assertNotEquals(first.getIv(), second.getIv());
        assertNotEquals(first.getCiphertext(), second.getCiphertext());
        assertEquals(first.getIntegrityTag(), second.getIntegrityTag());
    }

    @Test
    @DisplayName("A modified ciphertext fails authentication")
    void tamperedCiphertext() {
        EncryptedField field = encryptor.encrypt("E11.9,E66.01");
        byte[] sealed = Base64.getDecoder().decode(field.getCiphertext());
        sealed[0] ^= 0x01;
        EncryptedField tampered = EncryptedField.builder()
                .algorithm(field.getAlgorithm())
                .iv(field.getIv())
                .ciphertext(Base64.getEncoder().encodeToString(sealed))
                .integrityTag(field.getIntegrityTag())
                .build();

        assertThrows(WireProtocolException.class, () -> encryptor.decrypt(tampered));
    }

    @Test
    @DisplayName("A swapped integrity tag is detected after decryption")
    void swappedIntegrityTag() {
        EncryptedField field = encryptor.encrypt("1975-03-14");
        EncryptedField other = encryptor.encrypt("1980-01-01");
        EncryptedField swapped = EncryptedField.builder()
                .algorithm(field.getAlgorithm())
                .iv(field.getIv())
                .ciphertext(field.getCiphertext())
                .integrityTag(other.getIntegrityTag())
                .build();

        WireProtocolException e = assertThrows(WireProtocolException.class, () -> encryptor.decrypt(swapped));
        assertTrue(e.getMessage().contains("Integrity tag mismatch"));
    }

    @Test
    @DisplayName("Fields from a different key cannot be read")
    void differentKey() {
        AesGcmFieldEncryptor other = new AesGcmFieldEncryptor(base64("fedcba9876543210fedcba9876543210"), INTEGRITY_KEY);

        assertThrows(WireProtocolException.class, () -> encryptor.decrypt(other.encrypt("secret")));
    }

    @Test
    @DisplayName("Unknown algorithm and incomplete fields are rejected")
    void malformedFields() {
        EncryptedField field = encryptor.encrypt("x");

        assertThrows(WireProtocolException.class, () -> encryptor.decrypt(EncryptedField.builder()
                .algorithm("ROT13").iv(field.getIv()).ciphertext(field.getCiphertext())
                .integrityTag(field.getIntegrityTag()).build()));
        assertThrows(WireProtocolException.class, () -> encryptor.decrypt(EncryptedField.builder()
                .algorithm(field.getAlgorithm()).build()));
    }

    @Test
    @DisplayName("Missing or malformed keys fail every call with a configuration error")
    void missingKeysFailClosed() {
        AesGcmFieldEncryptor missing = new AesGcmFieldEncryptor(null, INTEGRITY_KEY);
        AesGcmFieldEncryptor shortKey = new AesGcmFieldEncryptor(base64("too-short"), INTEGRITY_KEY);
        AesGcmFieldEncryptor notBase64 = new AesGcmFieldEncryptor(ENCRYPTION_KEY, "%%%");

        assertFalse(missing.isConfigured());
        assertThrows(ConfigurationException.class, () -> missing.encrypt("x"));
        assertThrows(ConfigurationException.class, () -> shortKey.encrypt("x"));
        assertThrows(ConfigurationException.class, () -> notBase64.encrypt("x"));
        assertThrows(ConfigurationException.class, () -> missing.decrypt(encryptor.encrypt("x")));
        assertTrue(encryptor.isConfigured());
    }
}
