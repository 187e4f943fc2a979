package com.flagship.prior_auth.integration.pharmacy;

/**
 * Field-level authenticated encryption for pharmacy messages.
 */
public interface FieldEncryptor {

    /**
     * @throws com.flagship.prior_auth.error.ConfigurationException if no key is configured
     */
    EncryptedField encrypt(String plaintext);

    /**
     * @throws com.flagship.prior_auth.integration.WireProtocolException if the field was tampered with
     * @throws com.flagship.prior_auth.error.ConfigurationException if no key is configured
     */
    String decrypt(EncryptedField field);
}
