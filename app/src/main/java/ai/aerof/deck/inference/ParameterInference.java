package ai.aerof.deck.inference;

import ai.aerof.deck.tree.Scalar;
import ai.aerof.deck.tree.Tree;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts solver parameters from a natural-language simulation request using keyword and regex heuristics.
 * Facts that cannot be recognised are left out of the overlay.
 */
public class ParameterInference {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParameterInference.class);

    static final String FACT_SIMULATION_TYPE = "simulationType";
    static final String FACT_MESH_FILE = "meshFile";
    static final String FACT_REYNOLDS_NUMBER = "reynoldsNumber";
    static final String FACT_MACH_NUMBER = "machNumber";
    static final String FACT_ACCURACY_ORDER = "accuracyOrder";

    private static final Pattern MESH_FILE_PATTERN = Pattern.compile("(\\w+\\.msh)");
    private static final Pattern REYNOLDS_PATTERN = Pattern.compile("Re\\s*(\\d+)");
    private static final Pattern MACH_PATTERN = Pattern.compile("Mach\\s*(\\d+(?:\\.\\d+)?)");

    public InferredParameters infer(String request) {
        if (request == null || request.isBlank()) {
            return new InferredParameters(Tree.empty(), Map.of());
        }
        String lowered = request.toLowerCase(Locale.ROOT);
        Map<String, String> facts = new LinkedHashMap<>();
        Tree overlay = Tree.empty();

        Optional<String> simulationType = simulationType(lowered);
        if (simulationType.isPresent()) {
            facts.put(FACT_SIMULATION_TYPE, simulationType.get());
            overlay = overlay.set(List.of("Problem", "Type"), Scalar.of(simulationType.get()));
        }

        Optional<String> meshFile = firstGroup(MESH_FILE_PATTERN, request);
        if (meshFile.isPresent()) {
            facts.put(FACT_MESH_FILE, meshFile.get());
            overlay = overlay.set(List.of("Input", "Geometry"), Scalar.of(meshFile.get()));
        }

        Optional<String> reynolds = firstGroup(REYNOLDS_PATTERN, request);
        if (reynolds.isPresent()) {
            facts.put(FACT_REYNOLDS_NUMBER, reynolds.get());
            overlay = overlay.set(List.of("Input", "ReynoldsNumber"), Scalar.of(reynolds.get()));
        }

        Optional<String> mach = firstGroup(MACH_PATTERN, request);
        if (mach.isPresent()) {
            facts.put(FACT_MACH_NUMBER, mach.get());
            overlay = overlay.set(List.of("BoundaryConditions", "Inlet", "Mach"), Scalar.of(mach.get()));
        }

        Optional<String> order = accuracyOrder(lowered);
        if (order.isPresent()) {
            facts.put(FACT_ACCURACY_ORDER, order.get());
            String reconstruction = "2".equals(order.get()) ? "Linear" : "Constant";
            overlay = overlay.set(List.of("Space", "NavierStokes", "Reconstruction"), Scalar.of(reconstruction));
            overlay = overlay.set(List.of("Time", "Implicit", "Order"), Scalar.of(order.get()));
        }

        LOGGER.debug("Inferred {} facts from request: {}", facts.size(), facts);
        return new InferredParameters(overlay, facts);
    }

    // Order matters: "incompressible" contains "compressible" and "unsteady" contains "steady".
    private static Optional<String> simulationType(String lowered) {
        if (lowered.contains("incompressible flow simulation")) {
            return Optional.of("Incompressible");
        }
        if (lowered.contains("compressible flow simulation")) {
            return Optional.of("NavierStokes");
        }
        if (lowered.contains("unsteady")) {
            return Optional.of("Unsteady");
        }
        if (lowered.contains("steady")) {
            return Optional.of("Steady");
        }
        return Optional.empty();
    }

    private static Optional<String> accuracyOrder(String lowered) {
        if (lowered.contains("second order")) {
            return Optional.of("2");
        }
        if (lowered.contains("first order")) {
            return Optional.of("1");
        }
        return Optional.empty();
    }

    private static Optional<String> firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
