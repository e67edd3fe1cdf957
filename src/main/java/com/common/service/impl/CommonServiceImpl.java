package com.common.service.impl;

import com.common.service.CommonService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Slf4j
@Service("CommonService")
public class CommonServiceImpl implements CommonService {

    /** 16진수/콜론/점(IPv4 매핑) 으로만 된, 콜론을 포함한 주소 */
    private static final Pattern IPV6_LITERAL = Pattern.compile("^[0-9a-fA-F.]*:[0-9a-fA-F:.]*$");

    @Override
    public List<String> loadTargets(List<String> targets, String targetsFile) {
        // 결과를 누적할 리스트 생성
        List<String> list = new ArrayList<>();

        // 1) 프로퍼티의 쉼표 목록 추가
        if (targets != null) {
            for (String s : targets) {
                if (s == null) continue;          // null 방어
                String t = s.trim();               // 앞뒤 공백 제거
                if (!t.isEmpty()) list.add(t);     // 빈 문자열이 아니면 추가
            }
        }

        // 2) 파일 경로가 지정되었으면 파일에서 한 줄씩 읽어 추가
        if (stringNullCheck(targetsFile)) {
            try (BufferedReader br = new BufferedReader(new FileReader(targetsFile))) {
                String line;
                while ((line = br.readLine()) != null) {   // EOF까지 라인 반복
                    String t = line.trim();
                    if (t.isEmpty() || t.startsWith("#"))  // 빈 줄/주석(#) 무시
                        continue;
                    list.add(t);
                }
            } catch (IOException e) {
                // 파일이 없어도 설정 목록만으로 계속 진행
                log.warn("Could not read targets file {}: {}", targetsFile, e.getMessage());
            }
        }

        return list;
    }

    @Override
    public String[] parseTarget(String line, int defaultPort) {
        if (line == null) return null;
        String s = line.trim();
        if (s.isEmpty() || s.startsWith("#")) return null;        // 빈 줄/주석 무시

        // 스킴/경로가 붙은 입력(https://host/path)은 호스트 부분만 사용
        int scheme = s.indexOf("://");
        if (scheme >= 0) s = s.substring(scheme + 3);
        int slash = s.indexOf('/');
        if (slash >= 0) s = s.substring(0, slash);
        if (s.isEmpty()) return null;

        if (s.startsWith("[")) {                                  // [IPv6] 또는 [IPv6]:port
            int close = s.indexOf(']');
            if (close < 0) return null;
            String host = s.substring(1, close).trim();
            if (!IPV6_LITERAL.matcher(host).matches()) return null;
            String rest = s.substring(close + 1);
            if (rest.isEmpty()) return new String[]{host.toLowerCase(), String.valueOf(defaultPort)};
            if (!rest.startsWith(":")) return null;
            return withPort(host, rest.substring(1));
        }

        if (s.indexOf(':') != s.lastIndexOf(':')) {               // 괄호 없는 IPv6 는 포트 없이만 허용
            return IPV6_LITERAL.matcher(s).matches()
                    ? new String[]{s.toLowerCase(), String.valueOf(defaultPort)} : null;
        }

        if (s.contains(":")) {                                    // 포트 표기 있는 경우
            String[] parts = s.split(":", 2);
            String host = parts[0].trim();
            if (host.isEmpty()) return null;
            return withPort(host, parts[1]);
        }
        return new String[]{s.toLowerCase(), String.valueOf(defaultPort)};
    }

    private static String[] withPort(String host, String portText) {
        try {
            int port = Integer.parseInt(portText.trim());
            if (port < 1 || port > 65535) return null;            // 범위 밖 포트 무시
            return new String[]{host.toLowerCase(), String.valueOf(port)};
        } catch (NumberFormatException e) {
            return null;                                          // 잘못된 포트면 무시
        }
    }

    @Override
    public boolean stringNullCheck(String obj) {
        return obj != null && !obj.isBlank();
    }
}
