package com.localization.toolkit.storage;

import com.localization.toolkit.model.Attribute;
import com.localization.toolkit.model.Expression;
import com.localization.toolkit.model.FluentDefinition;
import com.localization.toolkit.model.FunctionReference;
import com.localization.toolkit.model.Message;
import com.localization.toolkit.model.MessageReference;
import com.localization.toolkit.model.Pattern;
import com.localization.toolkit.model.PatternElement;
import com.localization.toolkit.model.Placeable;
import com.localization.toolkit.model.SelectExpression;
import com.localization.toolkit.model.TermReference;
import com.localization.toolkit.model.VariableReference;
import com.localization.toolkit.model.Variant;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the ids a message or term refers to.
 *
 * <p>Message references are reported as {@code id} or {@code id.attr}, term
 * references as {@code -id}, and variables as {@code $name} (messages only;
 * term variables are parameters, not external inputs). Select expressions
 * contribute the references of their variants, not of the selector.
 */
public class FluentReferenceCollector {

    public Set<String> collect(FluentDefinition definition) {
        Set<String> references = new LinkedHashSet<>();
        boolean includeVariables = definition instanceof Message;

        if (definition.getValue() != null) {
            collectPattern(definition.getValue(), includeVariables, references);
        }
        for (Attribute attribute : definition.getAttributes()) {
            collectPattern(attribute.getValue(), includeVariables, references);
        }
        return references;
    }

    public Set<String> collectValue(FluentDefinition definition) {
        Set<String> references = new LinkedHashSet<>();
        if (definition.getValue() != null) {
            collectPattern(definition.getValue(), definition instanceof Message, references);
        }
        return references;
    }

    private void collectPattern(Pattern pattern, boolean includeVariables, Set<String> references) {
        for (PatternElement element : pattern.getElements()) {
            if (element instanceof Placeable placeable) {
                collectExpression(placeable.getExpression(), includeVariables, references);
            }
        }
    }

    private void collectExpression(Expression expression, boolean includeVariables, Set<String> references) {
        if (expression instanceof MessageReference reference) {
            String id = reference.getId().getName();
            references.add(reference.getAttribute() == null ? id : id + "." + reference.getAttribute().getName());
        } else if (expression instanceof TermReference reference) {
            references.add("-" + reference.getId().getName());
        } else if (expression instanceof VariableReference reference) {
            if (includeVariables) {
                references.add("$" + reference.getId().getName());
            }
        } else if (expression instanceof FunctionReference function) {
            for (Expression argument : function.getArguments().getPositional()) {
                collectExpression(argument, includeVariables, references);
            }
        } else if (expression instanceof SelectExpression select) {
            for (Variant variant : select.getVariants()) {
                collectPattern(variant.getValue(), includeVariables, references);
            }
        } else if (expression instanceof Placeable placeable) {
            collectExpression(placeable.getExpression(), includeVariables, references);
        }
    }
}
