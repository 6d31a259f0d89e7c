package arith.todo.endpoint.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConcatResponse(@JsonProperty("v") String v) {}
