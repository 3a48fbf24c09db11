package org.carball.plandoctor.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.plandoctor.model.plan.QueryPlan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads captured plans and their companion files from disk.
 */
@Slf4j
public class PlanFileReader {

    private final PlanParser planParser;

    public PlanFileReader() {
        this(new PlanParser());
    }

    public PlanFileReader(PlanParser planParser) {
        this.planParser = planParser;
    }

    /**
     * Reads a JSON plan file. A file whose content is not a usable plan still yields
     * a (degenerate) plan; only a missing or unreadable file is an error.
     */
    public QueryPlan readPlan(Path path) throws IOException {
        String content = readText(path);
        QueryPlan plan = planParser.parse(content);
        log.debug("Read plan from {} with root node '{}'", path, plan.getPlan().getNodeType());
        return plan;
    }

    public String readText(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("File not found: " + path);
        }
        return Files.readString(path);
    }
}
