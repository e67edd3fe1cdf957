package com.certhealth.service.impl;

import com.certhealth.entity.ProbeError;
import com.certhealth.entity.ProbeFailure;
import com.certhealth.entity.ProbeResult;
import com.certhealth.service.CertificateProber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import javax.security.auth.x500.X500Principal;
import java.io.IOException;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * 단일 호스트의 인증서 정보를 확인합니다.
 * - TLS 연결을 맺되, 신뢰 검증은 끄고(not verifying) 리프 인증서의 필드만 읽습니다.
 *   체인 검증/폐기 확인/피닝은 하지 않으며, 유효 여부는 유효기간 시간창으로만 판정합니다.
 * - SNI(Server Name Indication)를 설정하여 가상호스팅에서도 올바른 인증서를 받습니다.
 * - DNS 해석도 타임아웃 안에 끝나야 합니다. (넘기면 DNS 실패로 분류, 해석 스레드는 OS 리졸버가 끝낼 때까지 남음)
 * - 연결/핸드셰이크 전체가 타임아웃의 2배를 넘기면 워치독이 소켓을 닫습니다.
 */
@Slf4j
@Service("CertificateProber")
public class TlsCertificateProber implements CertificateProber, DisposableBean {

    static final String UNKNOWN_NAME = "Unknown";

    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private final Clock clock;
    private final HostResolver resolver;
    private final SSLSocketFactory socketFactory;
    private final ScheduledExecutorService watchdog;
    private final ExecutorService dnsLookups;

    /** 호스트 이름 해석 (테스트에서 교체 가능) */
    @FunctionalInterface
    public interface HostResolver {
        InetAddress resolve(String hostname) throws UnknownHostException;
    }

    @Autowired
    public TlsCertificateProber(Clock clock) {
        this(clock, InetAddress::getByName);
    }

    public TlsCertificateProber(Clock clock, HostResolver resolver) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.socketFactory = trustAllContext().getSocketFactory();
        this.watchdog = Executors.newSingleThreadScheduledExecutor(daemon("probe-watchdog"));
        this.dnsLookups = Executors.newCachedThreadPool(daemon("probe-dns"));
    }

    @Override
    public ProbeResult probe(String hostname, int port, Duration timeout) {
        Objects.requireNonNull(hostname, "hostname");
        int timeoutMs = toTimeoutMillis(timeout);
        long start = System.nanoTime();

        // 1) DNS 해석 (타임아웃 안에서만 기다림)
        InetAddress address;
        Future<InetAddress> lookup = dnsLookups.submit(() -> resolver.resolve(hostname));
        try {
            address = lookup.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            lookup.cancel(true);
            return failure(hostname, port, ProbeFailure.DNS_RESOLUTION_FAILED,
                    new UnknownHostException("lookup timed out after " + timeoutMs + "ms"), start);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return failure(hostname, port, ProbeFailure.DNS_RESOLUTION_FAILED,
                    cause instanceof Exception ? (Exception) cause : e, start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lookup.cancel(true);
            return failure(hostname, port, ProbeFailure.DNS_RESOLUTION_FAILED, e, start);
        }

        SSLSocket socket = null;
        AtomicBoolean timedOut = new AtomicBoolean(false);
        ScheduledFuture<?> guard = null;
        try {
            socket = (SSLSocket) socketFactory.createSocket();
            socket.setSoTimeout(timeoutMs);                        // 읽기 타임아웃(밀리초)

            // 응답을 조금씩 흘려보내는 호스트도 무한정 잡고 있지 않도록 전체 상한을 둡니다.
            SSLSocket watched = socket;
            guard = watchdog.schedule(() -> {
                timedOut.set(true);
                closeQuietly(watched);
            }, 2L * timeoutMs, TimeUnit.MILLISECONDS);

            // 2) TCP 연결
            try {
                socket.connect(new InetSocketAddress(address, port), timeoutMs);
            } catch (SocketTimeoutException e) {
                return failure(hostname, port, ProbeFailure.CONNECTION_TIMEOUT, e, start);
            } catch (ConnectException | NoRouteToHostException e) {
                return failure(hostname, port, ProbeFailure.CONNECTION_REFUSED, e, start);
            } catch (IOException e) {
                ProbeFailure kind = timedOut.get() ? ProbeFailure.CONNECTION_TIMEOUT : ProbeFailure.CONNECTION_REFUSED;
                return failure(hostname, port, kind, e, start);
            }

            // 3) SNI 설정 (IP 주소 등 SNI 불가 케이스는 생략)
            applyServerName(socket, hostname);

            // 4) TLS 핸드셰이크 수행 (서버 인증서 체인을 수신)
            try {
                socket.startHandshake();
            } catch (SocketTimeoutException e) {
                return failure(hostname, port, ProbeFailure.CONNECTION_TIMEOUT, e, start);
            } catch (IOException e) {
                // JSSE 는 읽기 타임아웃을 SSLException 으로 감싸기도 함
                ProbeFailure kind = timedOut.get() || causedByTimeout(e)
                        ? ProbeFailure.CONNECTION_TIMEOUT : ProbeFailure.TLS_HANDSHAKE_FAILED;
                return failure(hostname, port, kind, e, start);
            }

            // 5) 세션에서 인증서 체인을 얻음
            Certificate[] chain;
            try {
                chain = socket.getSession().getPeerCertificates();
            } catch (SSLPeerUnverifiedException e) {
                return failure(hostname, port, ProbeFailure.NO_CERTIFICATE_PRESENTED, e, start);
            }
            Optional<X509Certificate> leaf = leafOf(chain);
            if (leaf.isEmpty()) {
                return failure(hostname, port, ProbeFailure.NO_CERTIFICATE_PRESENTED, null, start);
            }

            // 6) 리프 인증서 필드 추출
            return fromLeaf(hostname, port, leaf.get(), clock, elapsedMs(start));
        } catch (IOException e) {
            // 소켓 생성/옵션 설정 단계 실패
            return failure(hostname, port, ProbeFailure.CONNECTION_REFUSED, e, start);
        } finally {
            if (guard != null) guard.cancel(false);
            closeQuietly(socket);
        }
    }

    /** 체인의 첫 번째(리프) X.509 인증서. 체인이 비었거나 X.509 가 아니면 empty */
    static Optional<X509Certificate> leafOf(Certificate[] chain) {
        if (chain == null || chain.length == 0 || !(chain[0] instanceof X509Certificate)) {
            return Optional.empty();
        }
        return Optional.of((X509Certificate) chain[0]);
    }

    /** 리프 인증서로부터 결과를 만듭니다. valid 는 clock 기준 시간창 판정입니다. */
    static ProbeResult fromLeaf(String hostname, int port, X509Certificate leaf, Clock clock, long elapsedMs) {
        return ProbeResult.success(hostname, port,
                displayName(leaf.getIssuerX500Principal()),
                displayName(leaf.getSubjectX500Principal()),
                leaf.getNotBefore().toInstant(),
                leaf.getNotAfter().toInstant(),
                clock.instant(),
                elapsedMs);
    }

    /** CN 우선, 없으면 O, 둘 다 없으면 "Unknown" */
    static String displayName(X500Principal principal) {
        if (principal == null) return UNKNOWN_NAME;
        String cn = null;
        String org = null;
        try {
            LdapName name = new LdapName(principal.getName(X500Principal.RFC2253));
            for (Rdn rdn : name.getRdns()) {
                if (cn == null && "CN".equalsIgnoreCase(rdn.getType())) cn = String.valueOf(rdn.getValue());
                if (org == null && "O".equalsIgnoreCase(rdn.getType())) org = String.valueOf(rdn.getValue());
            }
        } catch (InvalidNameException e) {
            log.debug("Unparseable X.500 name {}", principal.getName());
        }
        if (cn != null && !cn.isBlank()) return cn;
        if (org != null && !org.isBlank()) return org;
        return UNKNOWN_NAME;
    }

    static boolean isIpLiteral(String hostname) {
        return IPV4.matcher(hostname).matches() || hostname.indexOf(':') >= 0;
    }

    private static void applyServerName(SSLSocket socket, String hostname) {
        if (isIpLiteral(hostname)) return;
        SSLParameters params = socket.getSSLParameters();
        try {
            params.setServerNames(List.of(new SNIHostName(hostname)));
            socket.setSSLParameters(params);
        } catch (IllegalArgumentException e) {
            // SNI 로 쓸 수 없는 이름이면 SNI 없이 진행
            log.debug("Skipping SNI for {}: {}", hostname, e.getMessage());
        }
    }

    private ProbeResult failure(String hostname, int port, ProbeFailure kind, Exception cause, long start) {
        String detail = cause == null ? null : cause.getMessage();
        if (log.isDebugEnabled()) {
            log.debug("Probe {}:{} failed: {} ({})", hostname, port, kind, detail);
        }
        return ProbeResult.failure(hostname, port, new ProbeError(kind, detail), clock.instant(), elapsedMs(start));
    }

    private static boolean causedByTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }

    private static int toTimeoutMillis(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        return (int) Math.min(Integer.MAX_VALUE / 2, timeout.toMillis());
    }

    private static long elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }

    private static void closeQuietly(SSLSocket socket) {
        if (socket == null) return;
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Socket close failed: {}", e.getMessage());
        }
    }

    /** 모든 서버 인증서를 "신뢰"하도록 커스텀 TrustManager 구성 (만료/자체서명/호스트명 불일치라도 필드 읽기를 위해) */
    private static SSLContext trustAllContext() {
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, new TrustManager[]{new X509TrustManager() {
                public void checkClientTrusted(X509Certificate[] xcs, String s) {}
                public void checkServerTrusted(X509Certificate[] xcs, String s) {}
                public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
            }}, new SecureRandom());
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TLS context is not available", e);
        }
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void destroy() {
        watchdog.shutdownNow();
        dnsLookups.shutdownNow();
    }
}
