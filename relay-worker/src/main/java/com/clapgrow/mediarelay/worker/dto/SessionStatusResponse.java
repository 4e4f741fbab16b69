package com.clapgrow.mediarelay.worker.dto;

import com.clapgrow.mediarelay.worker.enums.SessionState;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionStatusResponse {
    private SessionState state;
    private String label;
    private boolean reconnecting;
    private int groups;
}
