package com.memberly.backend.member.store;

import com.memberly.backend.member.entity.Member;
import com.memberly.backend.member.exception.MemberNotFoundException;
import com.memberly.backend.member.repo.MemberRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@RequiredArgsConstructor
@Component
public class JpaMemberStore implements MemberStore {

    private final MemberRepository repo;

    @Override
    @Transactional(readOnly = true)
    public Optional<Member> findById(Long memberId) {
        if (memberId == null) return Optional.empty();
        return repo.findById(memberId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Member> findAll() {
        return repo.findAllOrderById();
    }

    /**
     * 每次 update 自成一個 transaction：方法返回時資料已 commit，
     * 呼叫端之後再發通知才不會出現「通知到了但 DB 還沒寫」。
     * <p>
     * 只改 managed instance 上的可變欄位，不走 merge：row 不存在時直接 404，不會被重新 insert。
     */
    @Override
    @Transactional
    public void update(Member member) {
        Long id = member.getId();
        if (id == null) throw new MemberNotFoundException(null);

        Member managed = repo.findById(id)
                .orElseThrow(() -> new MemberNotFoundException(id));

        managed.setName(member.getName());
        managed.setActive(member.isActive());
        managed.setSubscriptionEnd(member.getSubscriptionEnd().orElse(null));
    }
}
