package com.flagship.prior_auth.integration.pharmacy;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A field value protected for transit. All binary parts are base64.
 *
 * {@code integrityTag} is an HMAC over the plaintext, checked after decryption
 * independently of the cipher's own authentication tag.
 */
@Value
@Builder
@Jacksonized
public class EncryptedField {

    @JsonProperty("Algorithm")
    String algorithm;

    @JsonProperty("IV")
    String iv;

    @JsonProperty("CipherText")
    String ciphertext;

    @JsonProperty("IntegrityTag")
    String integrityTag;
}
