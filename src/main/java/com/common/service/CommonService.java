package com.common.service;

import java.util.List;

public interface CommonService {

    /**
     * 설정으로부터 타깃 목록을 읽어옵니다.
     * - targets : 쉼표 목록
     * - targetsFile : 라인 파일 (상대/절대 경로 모두 허용, # 주석 무시)
     */
    List<String> loadTargets(List<String> targets, String targetsFile);

    /**
     * "host[:port]" 문자열을 [host, port] 배열로 파싱 (포트 없으면 defaultPort, 불량이면 null)
     * IPv6 는 "[addr]:port" 로 포트를 붙이며, 괄호 없는 주소는 기본 포트로 읽습니다.
     */
    String[] parseTarget(String line, int defaultPort);

    // null 체크
    boolean stringNullCheck(String obj);
}
