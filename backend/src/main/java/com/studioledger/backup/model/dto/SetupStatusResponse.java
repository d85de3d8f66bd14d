package com.studioledger.backup.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SetupStatusResponse {

    private boolean setupComplete;
}
