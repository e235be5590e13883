package com.memberly.backend.member.repo;

import com.memberly.backend.member.entity.Member;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface MemberRepository extends JpaRepository<Member, Long> {

    @Query("select m from Member m order by m.id asc")
    List<Member> findAllOrderById();
}
