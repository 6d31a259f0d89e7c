package arith.todo.endpoint.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/** DELETE /deleteToDo 요청: {@code {"taskID": string}} */
public record DeleteToDoRequest(@JsonProperty("taskID") @JsonAlias("taskId") String taskId) {}
