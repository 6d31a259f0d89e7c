package arith.todo.error.exception;

import arith.todo.error.CommonErrorCode;
import arith.todo.error.exception.base.ClientBaseException;

/** 등록된 operation route와 맞지 않는 요청 (경로 없음 404, 메서드 불일치 405) */
public class UnknownRouteException extends ClientBaseException {

  private UnknownRouteException(CommonErrorCode errorCode, String method, String path) {
    super(errorCode, method, path);
  }

  public static UnknownRouteException notFound(String method, String path) {
    return new UnknownRouteException(CommonErrorCode.ROUTE_NOT_FOUND, method, path);
  }

  public static UnknownRouteException methodNotAllowed(String method, String path) {
    return new UnknownRouteException(CommonErrorCode.METHOD_NOT_ALLOWED, method, path);
  }
}
