package arith.todo.endpoint.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** {@code {"v": "up" | "down"}} */
public record PingResponse(@JsonProperty("v") String v) {}
