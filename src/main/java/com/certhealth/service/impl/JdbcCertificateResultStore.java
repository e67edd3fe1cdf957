package com.certhealth.service.impl;

import com.certhealth.entity.CertificateRecord;
import com.certhealth.service.CertificateResultStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * JDBC 결과 저장소 (certhealth.store.type=jdbc)
 * 테이블 ssl_certificate_checks 에 INSERT 만 수행합니다. (schema.sql)
 */
@Service("CertificateResultStore")
@ConditionalOnProperty(prefix = "certhealth.store", name = "type", havingValue = "jdbc")
public class JdbcCertificateResultStore implements CertificateResultStore {

    private static final String COLUMNS =
            "c.id, c.domain_id, c.issuer, c.subject, c.valid_from, c.valid_to, c.is_valid, c.error, c.checked_at";

    /** 같은 도메인에 더 최신(checked_at, id) 레코드가 없는 행 */
    private static final String IS_LATEST =
            "not exists (select 1 from ssl_certificate_checks n where n.domain_id = c.domain_id"
                    + " and (n.checked_at > c.checked_at or (n.checked_at = c.checked_at and n.id > c.id)))";

    private static final RowMapper<CertificateRecord> ROW_MAPPER = (rs, rowNum) -> CertificateRecord.builder()
            .domainId(rs.getString("domain_id"))
            .issuer(rs.getString("issuer"))
            .subject(rs.getString("subject"))
            .validFrom(toInstant(rs.getObject("valid_from", OffsetDateTime.class)))
            .validTo(toInstant(rs.getObject("valid_to", OffsetDateTime.class)))
            .valid(rs.getBoolean("is_valid"))
            .error(rs.getString("error"))
            .checkedAt(toInstant(rs.getObject("checked_at", OffsetDateTime.class)))
            .build();

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcCertificateResultStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void recordCertificateCheck(String domainId, CertificateRecord record) {
        InMemoryCertificateResultStore.checkOwnership(domainId, record);
        jdbc.update(
                "insert into ssl_certificate_checks(domain_id, issuer, subject, valid_from, valid_to, is_valid, error, checked_at)"
                        + " values(:d, :issuer, :subject, :from, :to, :valid, :error, :checked)",
                new MapSqlParameterSource()
                        .addValue("d", domainId)
                        .addValue("issuer", record.getIssuer())
                        .addValue("subject", record.getSubject())
                        .addValue("from", toUtc(record.getValidFrom()), Types.TIMESTAMP_WITH_TIMEZONE)
                        .addValue("to", toUtc(record.getValidTo()), Types.TIMESTAMP_WITH_TIMEZONE)
                        .addValue("valid", record.isValid())
                        .addValue("error", record.getError())
                        .addValue("checked", toUtc(record.getCheckedAt()), Types.TIMESTAMP_WITH_TIMEZONE));
    }

    @Override
    public Optional<CertificateRecord> getLatestCertificate(String domainId) {
        List<CertificateRecord> rows = jdbc.query(
                "select " + COLUMNS + " from ssl_certificate_checks c where c.domain_id = :d and " + IS_LATEST,
                new MapSqlParameterSource("d", domainId),
                ROW_MAPPER);
        return rows.stream().findFirst();
    }

    @Override
    public List<CertificateRecord> getCertificateHistory(String domainId) {
        return jdbc.query(
                "select " + COLUMNS + " from ssl_certificate_checks c where c.domain_id = :d"
                        + " order by c.checked_at desc, c.id desc",
                new MapSqlParameterSource("d", domainId),
                ROW_MAPPER);
    }

    @Override
    public List<CertificateRecord> findLatestValidExpiringBetween(Instant from, Instant to) {
        return jdbc.query(
                "select " + COLUMNS + " from ssl_certificate_checks c where " + IS_LATEST
                        + " and c.is_valid = true and c.valid_to >= :from and c.valid_to <= :to"
                        + " order by c.valid_to",
                new MapSqlParameterSource()
                        .addValue("from", toUtc(from), Types.TIMESTAMP_WITH_TIMEZONE)
                        .addValue("to", toUtc(to), Types.TIMESTAMP_WITH_TIMEZONE),
                ROW_MAPPER);
    }

    /** java.sql.Timestamp 는 JVM 시간대의 로컬 시각이라 DST 전환 때 순서가 뒤집힐 수 있음 */
    private static OffsetDateTime toUtc(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
