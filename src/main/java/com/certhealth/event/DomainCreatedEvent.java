package com.certhealth.event;

import com.certhealth.entity.Domain;
import lombok.Getter;
import lombok.ToString;
import org.springframework.context.ApplicationEvent;

/**
 * 도메인이 새로 등록되었을 때 레지스트리가 발행하는 이벤트입니다.
 * 스케줄러가 받아 해당 도메인 하나만 즉시 점검합니다.
 */
@Getter
@ToString
public class DomainCreatedEvent extends ApplicationEvent {

    private final Domain domain;

    public DomainCreatedEvent(Object source, Domain domain) {
        super(source);
        this.domain = domain;
    }
}
