package com.deepansh.focus.task;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TodoItemRepository extends MongoRepository<TodoItem, String> {

    List<TodoItem> findAllByOrderByPositionAsc();
}
