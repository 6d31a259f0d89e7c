package arith.todo.endpoint.dto;

/** GET /getAllToDo 요청. 본문은 무시합니다. */
public record GetAllToDoRequest() {}
