package io.github.cyfko.eligian.core.parsing;

import io.github.cyfko.eligian.core.api.CompilationContext;
import io.github.cyfko.eligian.core.ast.EligianAst.*;
import io.github.cyfko.eligian.core.exception.ValidationErrorKind;
import io.github.cyfko.eligian.core.exception.ValidationException;
import io.github.cyfko.eligian.core.model.SourceLocation;
import io.github.cyfko.eligian.core.model.TimelineProvider;
import io.github.cyfko.eligian.core.utils.LocationUtils;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Cross-reference checks that the grammar alone cannot express.
 * <p>
 * Declarations are checked first in source order: a single timeline with a known provider and,
 * for media providers, a source; unique event and action names. Action names are recorded in the
 * {@link CompilationContext} of the current compilation. Calls are then resolved against those
 * declarations and their argument counts checked. The first violation is thrown.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public final class SemanticValidator {

    private static final Logger log = Logger.getLogger(SemanticValidator.class.getName());

    private final CompilationContext context;
    private final String file;

    public SemanticValidator(CompilationContext context) {
        this.context = context;
        this.file = context.sourceFile().orElse(null);
    }

    /**
     * @param program the parsed program
     * @throws ValidationException on the first semantic violation
     */
    public void validate(Program program) {
        Map<String, ActionDeclaration> definitions = new HashMap<>();
        Set<String> events = new HashSet<>();
        TimelineDeclaration timeline = null;

        for (Element element : program.elements()) {
            if (element instanceof TimelineDeclaration declaration) {
                if (timeline != null) {
                    throw new ValidationException(ValidationErrorKind.DUPLICATE_DEFINITION,
                            "Only one timeline declaration is allowed", locate(declaration),
                            "Remove the extra timeline declaration");
                }
                timeline = declaration;
                checkTimeline(declaration);
            } else if (element instanceof EventDeclaration event) {
                if (!events.add(event.name())) {
                    throw new ValidationException(ValidationErrorKind.DUPLICATE_DEFINITION,
                            String.format("Duplicate event '%s'", event.name()), locate(event));
                }
            } else if (element instanceof ActionDeclaration action) {
                if (!context.declareAction(action.name())) {
                    throw new ValidationException(ValidationErrorKind.DUPLICATE_DEFINITION,
                            String.format("Duplicate action '%s'", action.name()), locate(action));
                }
                checkParameterOrder(action);
                definitions.put(action.name(), action);
            }
        }

        if (timeline == null) {
            throw new ValidationException(ValidationErrorKind.TIMELINE_REQUIRED,
                    "A timeline declaration is required", locate(program),
                    "Add a declaration such as: timeline raf");
        }

        for (Element element : program.elements()) {
            if (element instanceof EventDeclaration event) {
                checkCalls(event.actions(), definitions);
            } else if (element instanceof ActionDeclaration action) {
                checkCalls(action.startActions(), definitions);
                checkCalls(action.endActions(), definitions);
            }
        }

        log.fine(() -> String.format("Validated %d elements, %d action definitions, %d events",
                program.elements().size(), definitions.size(), events.size()));
    }

    private void checkTimeline(TimelineDeclaration declaration) {
        Optional<TimelineProvider> provider = TimelineProvider.fromName(declaration.provider());
        if (provider.isEmpty()) {
            String known = Arrays.stream(TimelineProvider.values())
                    .map(TimelineProvider::systemName)
                    .collect(Collectors.joining(", "));
            throw new ValidationException(ValidationErrorKind.INVALID_PROVIDER,
                    String.format("Unknown timeline provider '%s'", declaration.provider()),
                    locate(declaration), "Expected one of: " + known);
        }
        if (provider.get().isSourceRequired() && (declaration.source() == null || declaration.source().isBlank())) {
            throw new ValidationException(ValidationErrorKind.MISSING_SOURCE,
                    String.format("Timeline provider '%s' requires a source", provider.get().systemName()),
                    locate(declaration),
                    String.format("Use: timeline %s from \"media-file\"", provider.get().systemName()));
        }
    }

    private void checkParameterOrder(ActionDeclaration action) {
        ParameterNode defaulted = null;
        for (ParameterNode parameter : action.parameters()) {
            if (parameter.defaultValue() != null) {
                defaulted = parameter;
            } else if (defaulted != null) {
                throw new ValidationException(ValidationErrorKind.PARAMETER_ARITY_MISMATCH,
                        String.format("Parameter '%s' of action '%s' has no default but follows '%s', which has one",
                                parameter.name(), action.name(), defaulted.name()),
                        locate(parameter),
                        "Give '" + parameter.name() + "' a default or move it before '" + defaulted.name() + "'");
            }
        }
    }

    private void checkCalls(List<ActionNode> actions, Map<String, ActionDeclaration> definitions) {
        for (ActionNode action : actions) {
            if (!(action instanceof ActionCall call)) {
                continue;
            }
            ActionDeclaration definition = definitions.get(call.actionName());
            if (definition == null || !context.isActionDeclared(call.actionName())) {
                throw new ValidationException(ValidationErrorKind.ACTION_NOT_DEFINED,
                        String.format("Action '%s' is not defined", call.actionName()), locate(call),
                        "Declare it with: action " + call.actionName() + "(...) { ... }");
            }
            int max = definition.parameters().size();
            int required = (int) definition.parameters().stream()
                    .filter(p -> p.defaultValue() == null)
                    .count();
            int given = call.arguments().size();
            if (given < required || given > max) {
                String expected = required == max ? String.valueOf(max) : required + " to " + max;
                throw new ValidationException(ValidationErrorKind.PARAMETER_ARITY_MISMATCH,
                        String.format("Action '%s' expects %s argument(s) but got %d",
                                call.actionName(), expected, given),
                        locate(call));
            }
        }
    }

    private SourceLocation locate(Node node) {
        return LocationUtils.locate(node, file);
    }
}
