package com.codeprism.core.analyzer.pattern;

import com.codeprism.core.model.Entity;
import com.codeprism.core.parser.Statement;
import com.codeprism.core.parser.StatementKind;
import com.codeprism.core.parser.Token;
import com.codeprism.core.parser.TokenType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The probes every registry starts from.
 *
 * <p>Categories: {@code neural_network}, {@code optimization},
 * {@code attention_mechanism}, {@code linear_algebra} and {@code design_patterns}.
 */
final class BuiltinProbes {

    static final String NEURAL_NETWORK = "neural_network";
    static final String OPTIMIZATION = "optimization";
    static final String ATTENTION = "attention_mechanism";
    static final String LINEAR_ALGEBRA = "linear_algebra";
    static final String DESIGN_PATTERNS = "design_patterns";

    private static final Set<String> LAYER_BASES = Set.of("Layer", "Module", "Model", "Sequential");

    private static final Set<String> LAYER_TYPES = Set.of(
        "Dense", "Linear", "Conv1D", "Conv2D", "Conv3D", "Conv1d", "Conv2d", "Conv3d",
        "LSTM", "GRU", "RNN", "Sequential"
    );

    private static final Set<String> ACTIVATIONS = Set.of(
        "relu", "gelu", "sigmoid", "tanh", "softmax", "leaky_relu", "elu", "selu", "swish", "silu",
        "ReLU", "GELU", "Sigmoid", "Tanh", "Softmax", "LeakyReLU", "ELU", "SiLU"
    );

    private static final Set<String> ACTIVATION_LITERALS = Set.of(
        "relu", "gelu", "sigmoid", "tanh", "softmax", "elu", "selu", "swish", "silu"
    );

    private static final Set<String> OPTIMIZERS = Set.of(
        "Adam", "AdamW", "SGD", "RMSprop", "Adagrad", "Adadelta", "Adamax", "Nadam"
    );

    private static final Set<String> GRADIENTS = Set.of(
        "GradientTape", "gradient", "gradients", "backward", "grad", "apply_gradients", "zero_grad", "autograd"
    );

    private static final List<Set<String>> QKV_TRIPLES = List.of(
        Set.of("q", "k", "v"),
        Set.of("query", "key", "value"),
        Set.of("wq", "wk", "wv"),
        Set.of("q_proj", "k_proj", "v_proj")
    );

    private static final Set<String> MATMUL = Set.of("matmul", "dot", "einsum", "mm", "bmm");
    private static final Set<String> TRANSPOSE = Set.of("transpose", "T", "permute", "swapaxes");
    private static final Set<String> RESHAPE = Set.of("reshape", "flatten", "squeeze", "unsqueeze", "expand_dims");
    private static final Set<TokenType> LINE_STARTS = EnumSet.of(TokenType.NEWLINE, TokenType.INDENT, TokenType.DEDENT);

    private BuiltinProbes() {
    }

    static List<PatternProbe> all() {
        return List.of(
            new PatternProbe(NEURAL_NETWORK, "layers",
                "layer classes or layer constructors", BuiltinProbes::hasLayers),
            new PatternProbe(NEURAL_NETWORK, "activation_functions",
                "activation function names or activation= literals",
                ctx -> ctx.hasName(ACTIVATIONS) || ctx.hasStringLiteral(ACTIVATION_LITERALS)),
            new PatternProbe(NEURAL_NETWORK, "normalization",
                "layer/batch/group/instance normalization",
                ctx -> ctx.hasNameContaining("layernorm", "batchnorm", "groupnorm", "instancenorm",
                    "layer_norm", "batch_norm", "normalization")),
            new PatternProbe(NEURAL_NETWORK, "dropout",
                "dropout layers or calls", ctx -> ctx.hasNameContaining("dropout")),
            new PatternProbe(NEURAL_NETWORK, "embeddings",
                "embedding layers or tables", ctx -> ctx.hasNameContaining("embedding")),
            new PatternProbe(NEURAL_NETWORK, "residual_connections",
                "a function adds one of its inputs back to a computed value",
                BuiltinProbes::hasResidualConnection),

            new PatternProbe(OPTIMIZATION, "loss_functions",
                "loss or cross-entropy names", ctx -> ctx.hasNameContaining("loss", "crossentropy", "cross_entropy")),
            new PatternProbe(OPTIMIZATION, "optimizers",
                "optimizer classes or variables",
                ctx -> ctx.hasName(OPTIMIZERS) || ctx.hasNameContaining("optimizer")),
            new PatternProbe(OPTIMIZATION, "learning_rate_schedule",
                "learning rate schedules and warmup",
                ctx -> ctx.hasNameContaining("learning_rate", "learningrate", "lr_schedule", "scheduler", "warmup")),
            new PatternProbe(OPTIMIZATION, "gradient_computation",
                "gradient tapes, backward passes or gradient application", ctx -> ctx.hasName(GRADIENTS)),

            new PatternProbe(ATTENTION, "self_attention",
                "self-attention names, or a call passing the same tensor as query, key and value",
                ctx -> ctx.hasNameContaining("self_attention", "selfattention", "self_attn")
                    || hasTripleArgumentCall(ctx.tokens())),
            new PatternProbe(ATTENTION, "multi_head",
                "multi-head attention or head counts",
                ctx -> ctx.hasNameContaining("multihead", "multi_head", "num_heads", "n_heads")),
            new PatternProbe(ATTENTION, "scaled_dot_product",
                "matrix product scaled by a square root",
                ctx -> ctx.hasNameContaining("scaled_dot_product")
                    || (hasMatrixProduct(ctx) && ctx.hasName(Set.of("sqrt")))),
            new PatternProbe(ATTENTION, "query_key_value",
                "an attention class names query, key and value projections",
                BuiltinProbes::hasQueryKeyValue),
            new PatternProbe(ATTENTION, "softmax_attention",
                "a function body calls a softmax", BuiltinProbes::callsSoftmax),
            new PatternProbe(ATTENTION, "masking",
                "attention or padding masks", ctx -> ctx.hasNameContaining("mask")),

            new PatternProbe(LINEAR_ALGEBRA, "matrix_multiplication",
                "matmul-like calls or the @ operator", BuiltinProbes::hasMatrixProduct),
            new PatternProbe(LINEAR_ALGEBRA, "transpose",
                "transpositions and axis permutations", ctx -> ctx.hasName(TRANSPOSE)),
            new PatternProbe(LINEAR_ALGEBRA, "reshape",
                "reshaping calls", ctx -> ctx.hasName(RESHAPE)),
            new PatternProbe(LINEAR_ALGEBRA, "positional_encoding",
                "positional encodings", ctx -> ctx.hasNameContaining("positional", "pos_encoding")),

            new PatternProbe(DESIGN_PATTERNS, "inheritance",
                "a class has a base other than object",
                ctx -> ctx.classes().stream().anyMatch(c ->
                    c.baseClasses().stream().anyMatch(base -> !base.equals("object")))),
            new PatternProbe(DESIGN_PATTERNS, "composition",
                "an instance attribute is assigned a newly constructed object",
                ctx -> hasComposition(ctx.tokens())),
            new PatternProbe(DESIGN_PATTERNS, "factory",
                "factory-named functions, or functions returning a new instance",
                BuiltinProbes::hasFactory),
            new PatternProbe(DESIGN_PATTERNS, "decorators",
                "any decorated function, method or class",
                ctx -> ctx.inventory().entities().stream().anyMatch(e -> !e.decorators().isEmpty())),
            new PatternProbe(DESIGN_PATTERNS, "encapsulation",
                "non-public members (leading underscore, not dunder)", BuiltinProbes::hasEncapsulation)
        );
    }

    private static boolean hasLayers(PatternContext ctx) {
        for (Entity cls : ctx.classes()) {
            if (cls.name().endsWith("Layer")) {
                return true;
            }
            for (String base : cls.baseClasses()) {
                String simple = base.substring(base.lastIndexOf('.') + 1);
                if (LAYER_BASES.contains(simple) || simple.endsWith("Layer")) {
                    return true;
                }
            }
        }
        return ctx.hasName(LAYER_TYPES);
    }

    /**
     * Looks for {@code param + name} or {@code name = param + ...} in a function body.
     */
    private static boolean hasResidualConnection(PatternContext ctx) {
        if (ctx.hasNameContaining("residual", "skip_connection", "shortcut")) {
            return true;
        }
        for (Entity callable : ctx.callables()) {
            Set<String> inputs = new HashSet<>(callable.parameters());
            List<Token> body = bodyTokens(callable.definition());
            for (int i = 1; i + 1 < body.size(); i++) {
                Token previous = body.get(i - 1);
                boolean attribute = i > 1 && body.get(i - 2).isOp(".");
                if (body.get(i).isOp("+") && previous.isName() && !attribute
                        && inputs.contains(previous.text()) && body.get(i + 1).isName()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Matches {@code f(x, x, x ...)}.
     */
    private static boolean hasTripleArgumentCall(List<Token> tokens) {
        for (int i = 0; i + 5 < tokens.size(); i++) {
            if (tokens.get(i).isOp("(")
                    && tokens.get(i + 1).isName()
                    && tokens.get(i + 2).isOp(",")
                    && tokens.get(i + 3).isName(tokens.get(i + 1).text())
                    && tokens.get(i + 4).isOp(",")
                    && tokens.get(i + 5).isName(tokens.get(i + 1).text())) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasMatrixProduct(PatternContext ctx) {
        if (ctx.hasName(MATMUL)) {
            return true;
        }
        List<Token> tokens = ctx.tokens();
        for (int i = 1; i < tokens.size(); i++) {
            if (tokens.get(i).isOp("@") && !LINE_STARTS.contains(tokens.get(i - 1).type())) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasQueryKeyValue(PatternContext ctx) {
        for (Entity cls : ctx.classes()) {
            if (!cls.name().toLowerCase(Locale.ROOT).contains("attention")) {
                continue;
            }
            Set<String> names = new HashSet<>();
            for (Token token : cls.definition().allTokens()) {
                if (token.isName()) {
                    names.add(token.text().toLowerCase(Locale.ROOT));
                }
            }
            for (Set<String> triple : QKV_TRIPLES) {
                if (names.containsAll(triple)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean callsSoftmax(PatternContext ctx) {
        for (Entity callable : ctx.callables()) {
            List<Token> body = bodyTokens(callable.definition());
            for (int i = 0; i + 1 < body.size(); i++) {
                if (body.get(i).isName()
                        && body.get(i).text().toLowerCase(Locale.ROOT).contains("softmax")
                        && body.get(i + 1).isOp("(")) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Matches {@code self.attr = a.b.Ctor(} where the constructor name is capitalized.
     */
    private static boolean hasComposition(List<Token> tokens) {
        for (int i = 0; i + 4 < tokens.size(); i++) {
            if (!(tokens.get(i).isName("self") && tokens.get(i + 1).isOp(".")
                    && tokens.get(i + 2).isName() && tokens.get(i + 3).isOp("="))) {
                continue;
            }
            String constructor = null;
            int j = i + 4;
            while (j < tokens.size() && tokens.get(j).isName()) {
                constructor = tokens.get(j).text();
                if (j + 1 < tokens.size() && tokens.get(j + 1).isOp(".")) {
                    j += 2;
                } else {
                    j++;
                    break;
                }
            }
            if (constructor != null && j < tokens.size() && tokens.get(j).isOp("(")
                    && Character.isUpperCase(constructor.charAt(0))) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasFactory(PatternContext ctx) {
        for (Entity callable : ctx.callables()) {
            String name = callable.name();
            if (name.startsWith("create_") || name.startsWith("make_") || name.startsWith("build_")
                    || name.toLowerCase(Locale.ROOT).contains("factory")) {
                return true;
            }
            List<Statement> returns = new ArrayList<>();
            for (Statement statement : callable.definition().body()) {
                statement.walk(s -> {
                    if (s.kind() == StatementKind.RETURN) {
                        returns.add(s);
                    }
                });
            }
            for (Statement statement : returns) {
                if (returnsNewInstance(statement.tokens())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean returnsNewInstance(List<Token> tokens) {
        String head = null;
        int i = 1;
        while (i < tokens.size() && tokens.get(i).isName()) {
            head = tokens.get(i).text();
            if (i + 1 < tokens.size() && tokens.get(i + 1).isOp(".")) {
                i += 2;
            } else {
                i++;
                break;
            }
        }
        if (head == null || i >= tokens.size() || !tokens.get(i).isOp("(")) {
            return false;
        }
        return head.equals("cls") || Character.isUpperCase(head.charAt(0));
    }

    private static boolean hasEncapsulation(PatternContext ctx) {
        for (Entity callable : ctx.callables()) {
            if (isProtected(callable.name())) {
                return true;
            }
        }
        List<Token> tokens = ctx.tokens();
        for (int i = 0; i + 2 < tokens.size(); i++) {
            if (tokens.get(i).isName("self") && tokens.get(i + 1).isOp(".")
                    && tokens.get(i + 2).isName() && isProtected(tokens.get(i + 2).text())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isProtected(String name) {
        return name.length() > 1 && name.startsWith("_") && !(name.startsWith("__") && name.endsWith("__"));
    }

    private static List<Token> bodyTokens(Statement definition) {
        List<Token> tokens = new ArrayList<>();
        for (Statement statement : definition.body()) {
            tokens.addAll(statement.allTokens());
        }
        return tokens;
    }
}
