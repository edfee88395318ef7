package com.layoutstudio.backend.repo;

import com.layoutstudio.backend.service.editor.LayoutProject;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryStore {
    // projectId -> open project
    public final ConcurrentHashMap<String, LayoutProject> projects = new ConcurrentHashMap<>();
}
