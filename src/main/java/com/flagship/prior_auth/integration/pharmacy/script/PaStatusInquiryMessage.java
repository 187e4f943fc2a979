package com.flagship.prior_auth.integration.pharmacy.script;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JacksonXmlRootElement(localName = "PAStatusRequest")
public class PaStatusInquiryMessage {

    @JsonProperty("Header")
    ScriptHeader header;

    @JsonProperty("PAReferenceID")
    String paReferenceId;
}
