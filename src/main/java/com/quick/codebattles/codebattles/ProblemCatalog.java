package com.quick.codebattles.codebattles;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Read-only table of problem templates shared by every room.
 */
@Component
public class ProblemCatalog {

    private static final Logger log = LoggerFactory.getLogger(ProblemCatalog.class);
    private final List<ProblemTemplate> templates;

    @Autowired
    public ProblemCatalog(ObjectMapper objectMapper,
                          @Value("${codebattles.catalog.location:classpath:catalog/problems.json}") Resource location) {
        this(load(objectMapper, location));
        log.info("problem-catalog loaded templates={} location={}", templates.size(), location);
    }

    public ProblemCatalog(List<ProblemTemplate> templates) {
        if (templates == null || templates.isEmpty()) {
            throw new IllegalStateException("Problem catalog is empty");
        }
        this.templates = List.copyOf(templates);
    }

    public List<ProblemTemplate> templates() {
        return templates;
    }

    public int size() {
        return templates.size();
    }

    private static List<ProblemTemplate> load(ObjectMapper objectMapper, Resource location) {
        try (InputStream in = location.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<ProblemTemplate>>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load problem catalog from " + location, e);
        }
    }
}
