package com.forum.websocket.repository;

import com.forum.websocket.domain.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, String> {

    List<UserAccount> findByUsernameIn(Collection<String> usernames);
}
