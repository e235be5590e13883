package com.memberly.backend.member.service;

import com.memberly.backend.member.entity.Member;
import com.memberly.backend.member.store.MemberStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

@RequiredArgsConstructor
@Service
public class MemberService {

    private final MemberStore store;

    public Optional<Member> getMember(Long memberId) {
        return store.findById(memberId);
    }

    /**
     * 找不到視為 inactive；找到就原樣回傳旗標（不看 subscriptionEnd）。
     */
    public boolean isActive(Long memberId) {
        return store.findById(memberId)
                .map(Member::isActive)
                .orElse(false);
    }
}
