package org.neuralchilli.irflow.service;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.irflow.config.IrJson;
import org.neuralchilli.irflow.config.IrflowConfig;
import org.neuralchilli.irflow.core.ProgramNotFoundException;
import org.neuralchilli.irflow.domain.ComplexityAnalysis;
import org.neuralchilli.irflow.domain.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Keyed store of every compiled and optimized program, held in a Hazelcast map.
 * Values are serialized on write, so callers only ever see copies of what is stored.
 */
@ApplicationScoped
public class ProgramStoreService {

    private static final Logger log = LoggerFactory.getLogger(ProgramStoreService.class);

    @Inject
    HazelcastInstance hazelcast;

    @Inject
    IrflowConfig config;

    private IMap<String, IrProgram> programs;

    @PostConstruct
    void init() {
        programs = hazelcast.getMap(config.store().mapName());
        log.info("Program store using map '{}'", config.store().mapName());
    }

    public void save(IrProgram program) {
        programs.set(program.id(), program);
        log.debug("Stored program {} ({} nodes)", program.id(), program.nodes().size());
    }

    /**
     * @throws ProgramNotFoundException if no program has the id
     */
    public IrProgram get(String programId) {
        return find(programId).orElseThrow(() -> new ProgramNotFoundException(programId));
    }

    public Optional<IrProgram> find(String programId) {
        if (programId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(programs.get(programId));
    }

    /**
     * All stored programs, ordered by name then id.
     */
    public List<IrProgram> list() {
        List<IrProgram> all = new ArrayList<>(programs.values());
        all.sort(Comparator.comparing(IrProgram::name).thenComparing(IrProgram::id));
        return all;
    }

    public boolean contains(String programId) {
        return programId != null && programs.containsKey(programId);
    }

    /**
     * @return true if a program was removed
     */
    public boolean delete(String programId) {
        if (programId == null) {
            return false;
        }
        boolean removed = programs.remove(programId) != null;
        if (removed) {
            log.info("Deleted program {}", programId);
        }
        return removed;
    }

    public int size() {
        return programs.size();
    }

    /**
     * @throws ProgramNotFoundException if no program has the id
     */
    public ComplexityAnalysis analyzeComplexity(String programId) {
        return ComplexityAnalysis.of(get(programId));
    }

    /**
     * @throws ProgramNotFoundException if no program has the id
     */
    public String exportJson(String programId) {
        return IrJson.toPrettyJson(get(programId));
    }

    /**
     * Store a program from its JSON form, replacing any program with the same id.
     *
     * @throws IllegalArgumentException if the JSON is not a valid program
     */
    public IrProgram importJson(String json) {
        IrProgram program = IrJson.fromJson(json);
        save(program);
        log.info("Imported program {} ({})", program.id(), program.name());
        return program;
    }

    public void clear() {
        programs.clear();
    }
}
