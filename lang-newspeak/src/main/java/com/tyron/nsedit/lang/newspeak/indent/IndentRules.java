package com.tyron.nsedit.lang.newspeak.indent;

import java.util.List;
import java.util.OptionalInt;

/**
 * The Newspeak indentation rules, in the order they are tried.
 */
public final class IndentRules {

    private IndentRules() {
    }

    public static List<IndentRule> defaults() {
        return List.of(
                new InsideCommentRule(),
                new ClassDeclarationRule(),
                new ClosingParenRule(),
                new ModifierRule(),
                new PipeRule(),
                new BlockRule(),
                new NestingDepthRule());
    }

    /**
     * Lines that start inside a comment or a string keep their indentation.
     */
    static final class InsideCommentRule implements IndentRule {
        @Override
        public String getId() {
            return "insideComment";
        }

        @Override
        public OptionalInt computeIndent(IndentRequest request) {
            if (request.buffer().syntaxContextAt(request.lineStart()) == null) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(request.buffer().getIndentation(request.line()));
        }
    }

    static final class ClassDeclarationRule implements IndentRule {
        @Override
        public String getId() {
            return "classDeclaration";
        }

        @Override
        public OptionalInt computeIndent(IndentRequest request) {
            return request.probes().isClassLine(request.line()) ? OptionalInt.of(0) : OptionalInt.empty();
        }
    }

    static final class ClosingParenRule implements IndentRule {
        @Override
        public String getId() {
            return "closingParen";
        }

        @Override
        public OptionalInt computeIndent(IndentRequest request) {
            return request.probes().isClosingParenLine(request.line()) ? OptionalInt.of(0) : OptionalInt.empty();
        }
    }

    /**
     * Modified declarations are indented inside a slot list and flush left elsewhere.
     */
    static final class ModifierRule implements IndentRule {
        @Override
        public String getId() {
            return "modifier";
        }

        @Override
        public OptionalInt computeIndent(IndentRequest request) {
            ContextProbes probes = request.probes();
            if (!probes.isModifierLine(request.line())) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(probes.withinSlots(request.lineStart()) ? request.indentUnit() : 0);
        }
    }

    /**
     * A pipe line outside a block is a slot list delimiter. Inside a block the block rule decides.
     */
    static final class PipeRule implements IndentRule {
        @Override
        public String getId() {
            return "pipe";
        }

        @Override
        public OptionalInt computeIndent(IndentRequest request) {
            ContextProbes probes = request.probes();
            if (!probes.isPipeLine(request.line()) || probes.withinBlock(request.lineStart())) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(request.indentUnit());
        }
    }

    /**
     * Block contents sit one unit right of the line that opened the block; the closing line aligns with it.
     */
    static final class BlockRule implements IndentRule {
        @Override
        public String getId() {
            return "block";
        }

        @Override
        public OptionalInt computeIndent(IndentRequest request) {
            ContextProbes probes = request.probes();
            if (!probes.withinBlock(request.lineStart())) {
                return OptionalInt.empty();
            }
            int column = probes.columnOfEnclosingBlock(request.lineStart());
            if (column < 0) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(probes.closingBlock(request.line()) ? column : column + request.indentUnit());
        }
    }

    static final class NestingDepthRule implements IndentRule {
        @Override
        public String getId() {
            return "nestingDepth";
        }

        @Override
        public OptionalInt computeIndent(IndentRequest request) {
            int depth = request.probes().nestingDepth(request.lineStart());
            return OptionalInt.of(depth > 1 ? request.indentUnit() : 0);
        }
    }
}
