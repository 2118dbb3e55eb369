package com.forum.websocket.repository;

import com.forum.websocket.domain.Comment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CommentRepository extends JpaRepository<Comment, String> {

    List<Comment> findByThreadIdOrderByCreatedAt(String threadId);

    long countByParentId(String parentId);
}
