package arith.todo.error.exception;

import arith.todo.error.CommonErrorCode;
import arith.todo.error.exception.base.ServerBaseException;
import lombok.Getter;

/**
 * 원격 인스턴스가 non-2xx 5xx 응답을 돌려주었거나 호출 자체가 실패한 경우 (클라이언트 측)
 *
 * <p>메시지는 원격 에러 envelope의 {@code error} 값입니다.
 */
@Getter
public class RemoteServiceException extends ServerBaseException {

  /** 원격 응답 상태 코드, 응답을 받지 못했으면 0 */
  private final int remoteStatus;

  public RemoteServiceException(int remoteStatus, String remoteMessage) {
    super(CommonErrorCode.REMOTE_CALL_FAILED, remoteMessage);
    this.remoteStatus = remoteStatus;
  }

  public RemoteServiceException(String detail, Throwable cause) {
    super(CommonErrorCode.REMOTE_CALL_FAILED, cause, detail);
    this.remoteStatus = 0;
  }
}
