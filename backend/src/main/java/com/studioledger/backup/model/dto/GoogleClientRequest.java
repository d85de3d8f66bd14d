package com.studioledger.backup.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GoogleClientRequest {

    private String clientId;

    private String clientSecret;
}
