package com.hookrelay.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class SuccessResponse {
    private String message;
}
