package com.flagship.prior_auth.integration.pharmacy;

import com.flagship.prior_auth.config.IntegrationProperties;
import com.flagship.prior_auth.error.ConfigurationException;
import com.flagship.prior_auth.integration.WireProtocolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-GCM encryption with an HMAC-SHA256 tag over each plaintext.
 *
 * Keys come from configuration as base64. A missing or malformed key does not fail
 * startup; it fails every encrypt and decrypt call with {@link ConfigurationException},
 * so nothing is ever sent unencrypted.
 */
@Component
@Slf4j
public class AesGcmFieldEncryptor implements FieldEncryptor {

    public static final String ALGORITHM = "AES-GCM+HMAC-SHA256";
    private static final String CIPHER = "AES/GCM/NoPadding";
    private static final String MAC = "HmacSHA256";
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final SecretKeySpec encryptionKey;
    private final SecretKeySpec integrityKey;
    private final String keyProblem;
    private final SecureRandom random = new SecureRandom();

    @Autowired
    public AesGcmFieldEncryptor(IntegrationProperties properties) {
        this(properties.getPharmacy().getEncryptionKey(), properties.getPharmacy().getIntegrityKey());
    }

    public AesGcmFieldEncryptor(String base64EncryptionKey, String base64IntegrityKey) {
        SecretKeySpec aes = null;
        SecretKeySpec hmac = null;
        String problem = null;
        try {
            aes = aesKey(base64EncryptionKey);
            hmac = hmacKey(base64IntegrityKey);
        } catch (IllegalArgumentException e) {
            problem = e.getMessage();
            aes = null;
            hmac = null;
            log.warn("Pharmacy field encryption is unavailable: {}", problem);
        }
        this.encryptionKey = aes;
        this.integrityKey = hmac;
        this.keyProblem = problem;
    }

    public boolean isConfigured() {
        return keyProblem == null;
    }

    @Override
    public EncryptedField encrypt(String plaintext) {
        requireKeys();
        byte[] clear = (plaintext == null ? "" : plaintext).getBytes(StandardCharsets.UTF_8);
        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(clear);
            return EncryptedField.builder()
                    .algorithm(ALGORITHM)
                    .iv(Base64.getEncoder().encodeToString(iv))
                    .ciphertext(Base64.getEncoder().encodeToString(sealed))
                    .integrityTag(Base64.getEncoder().encodeToString(hmac(clear)))
                    .build();
        } catch (GeneralSecurityException e) {
            throw new ConfigurationException("Field encryption failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String decrypt(EncryptedField field) {
        requireKeys();
        if (field == null || field.getCiphertext() == null || field.getIv() == null || field.getIntegrityTag() == null) {
            throw new WireProtocolException("Encrypted field is incomplete");
        }
        if (!ALGORITHM.equals(field.getAlgorithm())) {
            throw new WireProtocolException("Unsupported field algorithm '" + field.getAlgorithm() + "'");
        }
        try {
            byte[] iv = Base64.getDecoder().decode(field.getIv());
            byte[] sealed = Base64.getDecoder().decode(field.getCiphertext());
            byte[] expectedTag = Base64.getDecoder().decode(field.getIntegrityTag());

            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, encryptionKey, new GCMParameterSpec(TAG_BITS, iv));
            byte[] clear = cipher.doFinal(sealed);

            if (!MessageDigest.isEqual(expectedTag, hmac(clear))) {
                throw new WireProtocolException("Integrity tag mismatch on encrypted field");
            }
            return new String(clear, StandardCharsets.UTF_8);

        } catch (AEADBadTagException e) {
            throw new WireProtocolException("Encrypted field failed authentication", e);
        } catch (IllegalArgumentException e) {
            throw new WireProtocolException("Encrypted field is not valid base64", e);
        } catch (GeneralSecurityException e) {
            throw new WireProtocolException("Encrypted field could not be decrypted: " + e.getMessage(), e);
        }
    }

    private byte[] hmac(byte[] clear) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(MAC);
        mac.init(integrityKey);
        return mac.doFinal(clear);
    }

    private void requireKeys() {
        if (keyProblem != null) {
            throw new ConfigurationException("Pharmacy field encryption is not configured: " + keyProblem);
        }
    }

    private static SecretKeySpec aesKey(String base64) {
        byte[] raw = decodeKey(base64, "encryption");
        if (raw.length != 16 && raw.length != 24 && raw.length != 32) {
            throw new IllegalArgumentException("encryption key must be 16, 24 or 32 bytes, got " + raw.length);
        }
        return new SecretKeySpec(raw, "AES");
    }

    private static SecretKeySpec hmacKey(String base64) {
        byte[] raw = decodeKey(base64, "integrity");
        if (raw.length < 32) {
            throw new IllegalArgumentException("integrity key must be at least 32 bytes, got " + raw.length);
        }
        return new SecretKeySpec(raw, MAC);
    }

    private static byte[] decodeKey(String base64, String name) {
        if (base64 == null || base64.isBlank()) {
            throw new IllegalArgumentException(name + " key is missing");
        }
        try {
            return Base64.getDecoder().decode(base64.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(name + " key is not valid base64");
        }
    }
}
