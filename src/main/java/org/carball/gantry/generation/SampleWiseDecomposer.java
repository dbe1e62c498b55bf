package org.carball.gantry.generation;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.ai.FieldGroupPromptBuilder;
import org.carball.gantry.ai.OracleException;
import org.carball.gantry.ai.OracleResponseValidator;
import org.carball.gantry.ai.PromptContext;
import org.carball.gantry.ai.TextGenerationOracle;
import org.carball.gantry.model.condition.GenerationCondition;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.FieldGroup;
import org.carball.gantry.model.schema.FieldGroupSchema;
import org.carball.gantry.model.schema.GantryFields;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Produces one record by generating its field groups in dependency order, one oracle call per
 * group. A group the oracle cannot deliver in time, or delivers malformed, is produced by the
 * rule-based generator instead and noted in the record's metadata.
 */
@Slf4j
public class SampleWiseDecomposer {

    static final String RULE_BASED = "rule-based";

    private final FieldGroupSchema schema;
    private final TextGenerationOracle oracle;
    private final FieldGroupPromptBuilder promptBuilder;
    private final OracleResponseValidator validator;
    private final RuleBasedGroupGenerator ruleGenerator;
    private final SectionDateMapper dateMapper;
    private final ExecutorService oracleExecutor;
    private final Duration oracleTimeout;

    /**
     * @param oracle         may be null, in which case every group is rule-based
     * @param oracleExecutor runs oracle calls so they can be abandoned after {@code oracleTimeout}
     */
    public SampleWiseDecomposer(FieldGroupSchema schema,
                                TextGenerationOracle oracle,
                                FieldGroupPromptBuilder promptBuilder,
                                OracleResponseValidator validator,
                                RuleBasedGroupGenerator ruleGenerator,
                                SectionDateMapper dateMapper,
                                ExecutorService oracleExecutor,
                                Duration oracleTimeout) {
        this.schema = schema;
        this.oracle = oracle;
        this.promptBuilder = promptBuilder;
        this.validator = validator;
        this.ruleGenerator = ruleGenerator;
        this.dateMapper = dateMapper;
        this.oracleExecutor = oracleExecutor;
        this.oracleTimeout = oracleTimeout;
    }

    /**
     * @param random private to this record; seeded by the caller for reproducibility
     */
    public TransactionRecord decompose(GenerationCondition condition, Demonstrations demonstrations,
                                       long sequence, Random random) {
        TransactionRecord record = new TransactionRecord();
        record.getMetadata().setCondition(condition);
        record.getMetadata().setSequence(sequence);

        List<TransactionRecord> examples = demonstrations.resolve();

        for (FieldGroup group : schema.getGenerationOrder()) {
            GroupRequest request = new GroupRequest(group, condition, record, sequence, random);
            Map<String, Object> values;
            if (oracle == null) {
                values = fallback(request, "oracle unavailable");
            } else {
                values = fromOracle(request, examples);
            }
            for (Map.Entry<String, Object> entry : values.entrySet()) {
                record.assign(entry.getKey(), entry.getValue());
            }
        }

        log.debug("Decomposed record #{} ({}), fallback groups {}",
                sequence, condition.key(), record.getMetadata().getFallbackGroups());
        return record;
    }

    private Map<String, Object> fromOracle(GroupRequest request, List<TransactionRecord> examples) {
        FieldGroup group = request.group();
        String prompt = promptBuilder.build(group, promptContext(request, examples));
        Future<Map<String, Object>> call = oracleExecutor.submit(() -> oracle.generate(prompt));
        try {
            Map<String, Object> response = call.get(oracleTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return validator.validate(group, response);
        } catch (TimeoutException e) {
            call.cancel(true);
            return fallback(request, "timeout after " + oracleTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return fallback(request, describe(cause));
        } catch (OracleException e) {
            return fallback(request, describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return fallback(request, "interrupted");
        }
    }

    private PromptContext promptContext(GroupRequest request, List<TransactionRecord> examples) {
        LocalDate samplingDate = null;
        Long mileageHint = null;
        String sectionId = request.partial().getString(GantryFields.SECTION_ID);
        if (GantryFields.GROUP_TIME.equals(request.group().name()) && sectionId != null) {
            samplingDate = dateMapper.dateFor(sectionId, request.random());
        }
        if (GantryFields.GROUP_FEE.equals(request.group().name())) {
            mileageHint = 20_000L + request.random().nextInt(130_001);
        }
        return new PromptContext(request.condition(), request.partial(), examples, samplingDate, mileageHint);
    }

    private Map<String, Object> fallback(GroupRequest request, String cause) {
        String group = request.group().name();
        if (oracle != null) {
            log.warn("Field group '{}' of record #{} falls back to rules: {}", group, request.sequence(), cause);
        }
        TransactionRecord record = request.partial();
        record.getMetadata().getFallbackGroups().add(group);
        record.logCorrection(group, null, RULE_BASED, "oracle fallback: " + cause);
        return ruleGenerator.generate(request);
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
