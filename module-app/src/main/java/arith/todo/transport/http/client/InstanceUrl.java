package arith.todo.transport.http.client;

import java.net.URI;

/** 원격 인스턴스 주소 정규화 */
public final class InstanceUrl {

  private static final String DEFAULT_SCHEME = "http://";

  private InstanceUrl() {}

  /**
   * scheme이 없으면 {@code http://}를 붙이고 끝의 {@code /}를 제거합니다.
   *
   * @throws IllegalArgumentException 비어 있거나 URI로 해석되지 않는 경우
   */
  public static String normalize(String instance) {
    if (instance == null || instance.isBlank()) {
      throw new IllegalArgumentException("instance address must not be blank");
    }
    String url = instance.strip();
    if (!url.startsWith("http")) {
      url = DEFAULT_SCHEME + url;
    }
    while (url.endsWith("/")) {
      url = url.substring(0, url.length() - 1);
    }
    URI uri = URI.create(url);
    if (uri.getHost() == null) {
      throw new IllegalArgumentException("instance address has no host: " + instance);
    }
    return url;
  }
}
