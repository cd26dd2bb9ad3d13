package com.arachnida.core.crawler;

import java.util.List;
import java.util.Set;

/** 페이지 텍스트에서 특정 태그의 속성값을 뽑아내는 전략 인터페이스. */
public interface MarkupScanner {
    /**
     * html 안의 &lt;tagName ...&gt; 들에서 attrName 값을 문서 순서대로 반환.
     * 값은 앞뒤 공백 제거 상태, 속성이 없는 태그는 아무것도 기여하지 않는다.
     * 비었거나 공백뿐인 값은 결과에 넣지 않는다. 엔진은 이를 전제로 하므로
     * 대체 구현도 같은 규칙을 지켜야 한다 (빈 src 가 페이지 자신의 디렉터리로 해석되지 않도록).
     */
    List<String> findAttributeValues(String html, String tagName, String attrName);

    /**
     * findAttributeValues 와 같되, 같은 태그의 filterAttr 값(공백 구분 토큰, 대소문자 무시)
     * 중 하나라도 acceptedTokens(소문자)에 있는 태그만 본다. 예: &lt;link rel="next" href&gt;
     */
    List<String> findAttributeValuesWhere(String html, String tagName, String attrName,
                                          String filterAttr, Set<String> acceptedTokens);
}
