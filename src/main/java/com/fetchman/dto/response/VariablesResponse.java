package com.fetchman.dto.response;

import java.util.List;

public record VariablesResponse(List<VariableView> variables) {
}
