package com.example.honeypot.controller.dto;

import com.example.honeypot.model.ExtractedIntelligence;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatResponse {
    private String status;
    private String reply;
    private Boolean scamDetected;
    private Integer totalMessagesExchanged;
    private ExtractedIntelligence extractedIntelligence;
    private String detail;

    public static ChatResponse error(String detail) {
        return ChatResponse.builder()
                .status("error")
                .reply("")
                .detail(detail)
                .build();
    }
}
