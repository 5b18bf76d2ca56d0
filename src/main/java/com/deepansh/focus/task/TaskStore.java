package com.deepansh.focus.task;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Ordered to-do list backed by MongoDB.
 *
 * Tasks are addressed by their description (case-insensitive, trimmed), the way the
 * model refers to them. Methods are synchronized because tool calls from a single
 * assistant turn may run concurrently.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TaskStore {

    private final TodoItemRepository repository;

    public synchronized List<TodoItem> list() {
        return repository.findAllByOrderByPositionAsc();
    }

    public synchronized TodoItem add(String text, String projectOrPath, String category) {
        TodoItem item = TodoItem.builder()
                .text(text)
                .projectOrPath(blankToNull(projectOrPath))
                .category(blankToNull(category))
                .position(nextPosition())
                .build();
        TodoItem saved = repository.save(item);
        log.info("Task added [id={}, position={}]", saved.getId(), saved.getPosition());
        return saved;
    }

    public synchronized Optional<TodoItem> find(String description) {
        return list().stream().filter(item -> matches(item, description)).findFirst();
    }

    public synchronized boolean remove(String description) {
        Optional<TodoItem> item = find(description);
        item.ifPresent(repository::delete);
        return item.isPresent();
    }

    public synchronized boolean markComplete(String description) {
        return update(description, item -> item.setDone(true));
    }

    /**
     * Applies a change to the first task matching the description and saves it.
     * Returns false when no task matches.
     */
    public synchronized boolean update(String description, Consumer<TodoItem> change) {
        Optional<TodoItem> item = find(description);
        if (item.isEmpty()) {
            return false;
        }
        change.accept(item.get());
        repository.save(item.get());
        return true;
    }

    /**
     * Moves the named tasks to the top in the given order. Unnamed tasks keep their
     * relative order after them. Nothing is written when any name is unknown.
     */
    public synchronized void reorder(List<String> orderedDescriptions) {
        List<TodoItem> current = list();
        Set<TodoItem> front = new LinkedHashSet<>();
        for (String description : orderedDescriptions) {
            TodoItem item = current.stream()
                    .filter(candidate -> matches(candidate, description))
                    .findFirst()
                    .orElseThrow(() -> new TaskNotFoundException(description));
            front.add(item);
        }

        List<TodoItem> reordered = new ArrayList<>(front);
        current.stream().filter(item -> !front.contains(item)).forEach(reordered::add);
        renumber(reordered);
    }

    /**
     * Moves completed tasks below every open task, keeping relative order within each group.
     * Returns how many completed tasks moved; nothing is written when that is zero.
     */
    public synchronized int moveCompletedToEnd() {
        List<TodoItem> current = list();
        int moved = 0;
        boolean openSeen = false;
        for (int i = current.size() - 1; i >= 0; i--) {
            if (!current.get(i).isDone()) {
                openSeen = true;
            } else if (openSeen) {
                moved++;
            }
        }
        if (moved == 0) {
            return 0;
        }

        List<TodoItem> reordered = new ArrayList<>(current.size());
        current.stream().filter(item -> !item.isDone()).forEach(reordered::add);
        current.stream().filter(TodoItem::isDone).forEach(reordered::add);
        renumber(reordered);
        log.info("Moved {} completed tasks below open ones", moved);
        return moved;
    }

    /**
     * Inserts subtasks where the original task sits, optionally removing the original.
     */
    public synchronized List<TodoItem> breakDown(String originalDescription, List<String> subtasks,
                                                 boolean replaceOriginal) {
        List<TodoItem> current = new ArrayList<>(list());
        int index = -1;
        for (int i = 0; i < current.size(); i++) {
            if (matches(current.get(i), originalDescription)) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            throw new TaskNotFoundException(originalDescription);
        }

        TodoItem original = current.get(index);
        List<TodoItem> created = subtasks.stream()
                .map(text -> TodoItem.builder()
                        .text(text)
                        .category(original.getCategory())
                        .projectOrPath(original.getProjectOrPath())
                        .build())
                .toList();

        if (replaceOriginal) {
            current.remove(index);
            repository.delete(original);
            current.addAll(index, created);
        } else {
            current.addAll(index + 1, created);
        }
        renumber(current);
        return created;
    }

    private void renumber(List<TodoItem> ordered) {
        for (int i = 0; i < ordered.size(); i++) {
            ordered.get(i).setPosition(i);
        }
        repository.saveAll(ordered);
    }

    private int nextPosition() {
        List<TodoItem> items = repository.findAllByOrderByPositionAsc();
        return items.isEmpty() ? 0 : items.get(items.size() - 1).getPosition() + 1;
    }

    private static boolean matches(TodoItem item, String description) {
        return item.getText() != null && description != null
                && item.getText().trim().equalsIgnoreCase(description.trim());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
