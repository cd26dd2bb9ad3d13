// ITransport.java
package com.arachnida.core.api;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 네트워크 전송 계약: 페이지 텍스트 요청 + 파일 다운로드.
 * 구현체는 예외를 던지지 않고 실패를 Response 로 돌려준다.
 */
public interface ITransport extends AutoCloseable {

    final class Response {
        public final int status;                // HTTP status (0 이면 네트워크 오류/타임아웃)
        public final String body;               // fetchText 본문, downloadTo 는 ""
        public final Optional<String> error;    // 오류 메시지

        public Response(int status, String body, String error) {
            this.status = status;
            this.body = body == null ? "" : body;
            this.error = Optional.ofNullable(error);
        }
        public static Response ok(int status, String body) {
            return new Response(status, body, null);
        }
        public static Response fail(int status, String msg) {
            return new Response(status, "", msg);
        }

        /** 2xx 이고 오류가 없으면 성공 */
        public boolean ok() {
            return error.isEmpty() && status >= 200 && status < 300;
        }

        public String describe() {
            return error.orElse("status " + status);
        }
    }

    /** 페이지 요청. 네트워크 오류/비 2xx/타임아웃은 모두 실패 */
    Response fetchText(String url, String userAgent);

    /** destination 에 저장. 실패 시 destination 은 호출 전 상태 그대로, 받다 만 데이터는 남지 않는다 */
    Response downloadTo(String url, String userAgent, Path destination);

    @Override default void close() throws Exception {}
}
