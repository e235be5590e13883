package com.memberly.backend.member.dto;

import com.memberly.backend.member.entity.Member;

import java.time.Instant;

public class MemberDtos {

    /** GET /api/v1/members/{id} */
    public record MemberDto(
            Long id,
            String name,
            boolean active,
            Instant subscriptionEnd
    ) {
        public static MemberDto from(Member m) {
            return new MemberDto(
                    m.getId(),
                    m.getName(),
                    m.isActive(),
                    m.getSubscriptionEnd().orElse(null)
            );
        }
    }

    /** GET /api/v1/members/{id}/active */
    public record ActiveStatusDto(
            Long memberId,
            boolean active
    ) {}
}
