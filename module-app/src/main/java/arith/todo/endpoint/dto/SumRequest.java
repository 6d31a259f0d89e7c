package arith.todo.endpoint.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/** POST /sum 요청: {@code {"A": int, "B": int}}. 피연산자는 64비트까지 허용하고 합의 범위는 서비스가 검사합니다. */
public record SumRequest(
    @JsonProperty("A") @JsonAlias("a") long a, @JsonProperty("B") @JsonAlias("b") long b) {}
