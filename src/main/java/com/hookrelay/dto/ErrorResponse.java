package com.hookrelay.dto;

import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class ErrorResponse {
    private List<String> errors;
}
