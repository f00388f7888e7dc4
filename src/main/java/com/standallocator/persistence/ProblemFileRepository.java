package com.standallocator.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.standallocator.domain.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a {@link StandAllocationProblem} from a JSON document.
 *
 * <pre>
 * {
 *   "turns":  [{"turnId": "1", "turnSeq": 0, "flightId": "FR13", "arrivalTime": 20, "departureTime": 55}],
 *   "stands": [{"standId": "1L"}],
 *   "forbidden": [{"turnId": "1", "turnSeq": 0, "standId": "1L"}],
 *   "adjacencyRules": [{
 *     "ruleId": "1", "name": "1L_1C_adjacency", "description": "...",
 *     "standA": "1L", "standB": "1C",
 *     "timeConstraintA": {"startAnchor": "ARRIVAL", "startOffsetMinutes": 0,
 *                         "endAnchor": "DEPARTURE", "endOffsetMinutes": 0},
 *     "timeConstraintB": {...}
 *   }]
 * }
 * </pre>
 *
 * Pairs not listed under "forbidden" are feasible. "turnSeq", offsets and
 * "description" are optional.
 */
public class ProblemFileRepository {

    private static final Logger log = LoggerFactory.getLogger(ProblemFileRepository.class);

    private final ObjectMapper objectMapper;

    public ProblemFileRepository() {
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public StandAllocationProblem load(Path path) throws ProblemLoadException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new ProblemLoadException("Cannot read problem file " + path, e);
        }
    }

    /**
     * Loads a problem bundled on the classpath, e.g. "/sample-problem.json".
     */
    public StandAllocationProblem loadResource(String resource) throws ProblemLoadException {
        try (InputStream in = ProblemFileRepository.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ProblemLoadException("Problem resource not found: " + resource);
            }
            return load(in, resource);
        } catch (IOException e) {
            throw new ProblemLoadException("Cannot read problem resource " + resource, e);
        }
    }

    public StandAllocationProblem load(InputStream in, String source) throws ProblemLoadException {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new ProblemLoadException("Malformed JSON in " + source, e);
        }
        if (root == null || !root.isObject()) {
            throw new ProblemLoadException("Problem document " + source + " must be a JSON object");
        }

        try {
            List<Turn> turns = parseTurns(root.path("turns"));
            List<Stand> stands = parseStands(root.path("stands"));
            FeasibilityMatrix feasibility = parseFeasibility(root.path("forbidden"), turns, stands);
            List<AdjacencyRule> rules = parseRules(root.path("adjacencyRules"));

            StandAllocationProblem problem = new StandAllocationProblem(turns, stands, feasibility, rules);
            log.info("Loaded {} from {}", problem, source);
            return problem;
        } catch (ConfigurationException e) {
            throw new ProblemLoadException("Invalid problem in " + source + ": " + e.getMessage(), e);
        }
    }

    private List<Turn> parseTurns(JsonNode data) throws ProblemLoadException {
        List<Turn> turns = new ArrayList<>();
        for (JsonNode node : requireArray(data, "turns")) {
            turns.add(new Turn(
                requireText(node, "turnId"),
                optionalInt(node, "turnSeq"),
                node.hasNonNull("flightId") ? node.get("flightId").asText() : null,
                requireInt(node, "arrivalTime"),
                requireInt(node, "departureTime")));
        }
        return turns;
    }

    private List<Stand> parseStands(JsonNode data) throws ProblemLoadException {
        List<Stand> stands = new ArrayList<>();
        for (JsonNode node : requireArray(data, "stands")) {
            stands.add(new Stand(requireText(node, "standId")));
        }
        return stands;
    }

    private FeasibilityMatrix parseFeasibility(JsonNode data, List<Turn> turns, List<Stand> stands)
            throws ProblemLoadException {
        FeasibilityMatrix.Builder builder = FeasibilityMatrix.builder(turns.size(), stands.size());
        if (data.isMissingNode() || data.isNull()) {
            return builder.build();
        }
        for (JsonNode node : requireArray(data, "forbidden")) {
            String turnId = requireText(node, "turnId");
            int turnSeq = optionalInt(node, "turnSeq");
            int turnIndex = indexOfTurn(turns, turnId, turnSeq);
            if (turnIndex < 0) {
                throw new ProblemLoadException("Forbidden pair references unknown turn " + turnId + "/" + turnSeq);
            }
            String standId = requireText(node, "standId");
            int standIndex = stands.indexOf(new Stand(standId));
            if (standIndex < 0) {
                throw new ProblemLoadException("Forbidden pair references unknown stand " + standId);
            }
            builder.forbid(turnIndex, standIndex);
        }
        return builder.build();
    }

    private static int indexOfTurn(List<Turn> turns, String turnId, int turnSeq) {
        for (int t = 0; t < turns.size(); t++) {
            if (turns.get(t).getTurnId().equals(turnId) && turns.get(t).getTurnSeq() == turnSeq) {
                return t;
            }
        }
        return -1;
    }

    private List<AdjacencyRule> parseRules(JsonNode data) throws ProblemLoadException {
        List<AdjacencyRule> rules = new ArrayList<>();
        if (data.isMissingNode() || data.isNull()) {
            return rules;
        }
        for (JsonNode node : requireArray(data, "adjacencyRules")) {
            rules.add(new AdjacencyRule(
                requireText(node, "ruleId"),
                node.hasNonNull("name") ? node.get("name").asText() : null,
                node.hasNonNull("description") ? node.get("description").asText() : null,
                requireText(node, "standA"),
                requireText(node, "standB"),
                parseWindow(node.path("timeConstraintA"), "timeConstraintA"),
                parseWindow(node.path("timeConstraintB"), "timeConstraintB")));
        }
        return rules;
    }

    private TimeWindowDefinition parseWindow(JsonNode node, String field) throws ProblemLoadException {
        if (!node.isObject()) {
            throw new ProblemLoadException("Adjacency rule field '" + field + "' must be an object");
        }
        return new TimeWindowDefinition(
            parseAnchor(node, "startAnchor"),
            optionalInt(node, "startOffsetMinutes"),
            parseAnchor(node, "endAnchor"),
            optionalInt(node, "endOffsetMinutes"));
    }

    private TimeAnchor parseAnchor(JsonNode node, String field) throws ProblemLoadException {
        String value = requireText(node, field);
        try {
            return TimeAnchor.valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new ProblemLoadException("Field '" + field + "' must be ARRIVAL or DEPARTURE, got " + value, e);
        }
    }

    private static JsonNode requireArray(JsonNode node, String field) throws ProblemLoadException {
        if (!node.isArray()) {
            throw new ProblemLoadException("Field '" + field + "' must be an array");
        }
        return node;
    }

    private static String requireText(JsonNode node, String field) throws ProblemLoadException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            throw new ProblemLoadException("Missing field '" + field + "' in " + node);
        }
        return value.asText();
    }

    private static int requireInt(JsonNode node, String field) throws ProblemLoadException {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new ProblemLoadException("Field '" + field + "' must be an integer in " + node);
        }
        return value.intValue();
    }

    // Missing means 0; anything present must be a whole number
    private static int optionalInt(JsonNode node, String field) throws ProblemLoadException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return 0;
        }
        return requireInt(node, field);
    }
}
