package com.memberly.backend.member.store;

import com.memberly.backend.member.entity.Member;

import java.util.List;
import java.util.Optional;

/**
 * Member 持久層的能力介面：lifecycle 只透過這三個操作碰資料。
 * 實作需可被多執行緒同時呼叫；同一 member 的併發寫入為 last-write-wins。
 */
public interface MemberStore {

    Optional<Member> findById(Long memberId);

    /** 回傳目前全部 member（不做任何篩選） */
    List<Member> findAll();

    /**
     * 以 id 為 key 寫入 member 目前的欄位值。
     * id 不存在時丟 {@link com.memberly.backend.member.exception.MemberNotFoundException}。
     */
    void update(Member member);
}
