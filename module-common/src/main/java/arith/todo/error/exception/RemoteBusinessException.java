package arith.todo.error.exception;

import arith.todo.error.CommonErrorCode;
import arith.todo.error.exception.base.ClientBaseException;
import lombok.Getter;

/**
 * 원격 인스턴스가 4xx 에러 envelope으로 응답한 경우 (클라이언트 측)
 *
 * <p>원격 서버가 비즈니스 검증 실패로 분류한 에러이므로 클라이언트에서도 비즈니스 실패로 취급합니다.
 */
@Getter
public class RemoteBusinessException extends ClientBaseException {

  private final int remoteStatus;

  public RemoteBusinessException(int remoteStatus, String remoteMessage) {
    super(CommonErrorCode.REMOTE_REJECTED, remoteMessage);
    this.remoteStatus = remoteStatus;
  }
}
