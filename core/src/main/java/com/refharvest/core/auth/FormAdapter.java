package com.refharvest.core.auth;

import com.refharvest.core.model.Credentials;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 사이트별 폼 필드 수집 전략.
 * 사이트 개편에 취약한 부분(폼 선택, 필드 이름)을 크롤 코어에서 분리한다.
 */
public interface FormAdapter {

    /** 로그인 페이지에서 로그인 폼 선택 */
    Optional<Element> loginForm(Document page);

    /** 로그인 POST 본문(순서 유지). 숨김 필드 + 자격 증명. */
    Map<String, String> loginFields(Element form, Credentials credentials);

    /** 보호 페이지에서 약관 동의 폼 선택 */
    Optional<Element> termsForm(Document page);

    /** 약관 동의 POST 본문(순서 유지) */
    Map<String, String> termsFields(Element form);

    /** 로그인 성공으로 볼 최종 URL 조각(설정값과 합쳐 사용) */
    default List<String> successUrlFragments() { return List.of(); }
}
