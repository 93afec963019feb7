package com.skillgraph.audit.cli;

import com.skillgraph.audit.registry.RegistryModels.RegistryExport;
import com.skillgraph.audit.repository.RegistryJdbcRepository;
import com.skillgraph.audit.service.AuditService;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Turns an export location (file path or {@code jdbc:} URL) into a raw registry export. */
@Component
public class RegistrySourceReader {
    private final AuditService auditService;

    public RegistrySourceReader(AuditService auditService) {
        this.auditService = auditService;
    }

    public RegistryExport read(String location, String user, String password) {
        if (location.startsWith("jdbc:")) {
            DriverManagerDataSource dataSource = new DriverManagerDataSource(location);
            if (user != null) dataSource.setUsername(user);
            if (password != null) dataSource.setPassword(password);
            return new RegistryJdbcRepository(new JdbcTemplate(dataSource)).loadExport();
        }
        try {
            return auditService.parse(Files.readString(Path.of(location), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + location, e);
        }
    }
}
