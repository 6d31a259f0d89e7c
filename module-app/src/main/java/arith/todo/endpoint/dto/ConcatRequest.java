package arith.todo.endpoint.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/** POST /concat 요청: {@code {"A": string, "B": string}} */
public record ConcatRequest(
    @JsonProperty("A") @JsonAlias("a") String a, @JsonProperty("B") @JsonAlias("b") String b) {}
