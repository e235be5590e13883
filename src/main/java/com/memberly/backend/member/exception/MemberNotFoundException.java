package com.memberly.backend.member.exception;

import lombok.Getter;

@Getter
public class MemberNotFoundException extends IllegalArgumentException {

    public static final String MESSAGE = "Member not found";

    private final Long memberId;

    public MemberNotFoundException(Long memberId) {
        super(MESSAGE);
        this.memberId = memberId;
    }
}
