package com.memberly.backend.member.controller;

import com.memberly.backend.member.dto.MemberDtos;
import com.memberly.backend.member.exception.MemberNotFoundException;
import com.memberly.backend.member.service.MemberService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/members")
public class MemberController {

    private final MemberService service;

    @GetMapping("/{memberId}")
    public MemberDtos.MemberDto get(@PathVariable Long memberId) {
        return service.getMember(memberId)
                .map(MemberDtos.MemberDto::from)
                .orElseThrow(() -> new MemberNotFoundException(memberId));
    }

    /** 不存在的 member 也回 200 + active=false */
    @GetMapping("/{memberId}/active")
    public MemberDtos.ActiveStatusDto active(@PathVariable Long memberId) {
        return new MemberDtos.ActiveStatusDto(memberId, service.isActive(memberId));
    }
}
