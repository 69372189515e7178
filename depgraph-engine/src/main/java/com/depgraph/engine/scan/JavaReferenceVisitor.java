package com.depgraph.engine.scan;

import com.depgraph.engine.graph.ReferenceForm;
import com.depgraph.engine.graph.RelationKind;
import com.depgraph.engine.graph.SymbolIds;
import org.eclipse.jdt.core.dom.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * ASTVisitor that collects method and constructor declarations together with the references made
 * from their bodies, in a single pass over an unbound compilation unit.
 *
 * <p>Declarations are named {@code Type.method} ({@code Type.<init>} for constructors, nested types
 * joined with dots). Code outside any method belongs to the file's module pseudo-symbol.
 */
class JavaReferenceVisitor extends ASTVisitor {

    private static final Logger log = LoggerFactory.getLogger(JavaReferenceVisitor.class);

    private static final Set<String> REFLECTIVE_LOOKUPS = Set.of("getMethod", "getDeclaredMethod");
    private static final Set<String> HANDLE_LOOKUPS = Set.of("findVirtual", "findStatic", "findSpecial");

    private record Owner(String name, int arity) {}

    private final String path;
    private final CompilationUnit cu;

    private final Map<String, SymbolDraft> symbols = new LinkedHashMap<>();
    private final List<ReferenceDraft> references = new ArrayList<>();

    private final Deque<String> types = new ArrayDeque<>();
    private final Deque<Owner> owners = new ArrayDeque<>();
    // variable name -> simple type name, innermost scope first
    private final Deque<Map<String, String>> scopes = new ArrayDeque<>();
    private int conditionalDepth = 0;

    JavaReferenceVisitor(String path, CompilationUnit cu) {
        this.path = path;
        this.cu = cu;
        owners.push(new Owner(SymbolIds.MODULE_NAME, 0));
    }

    List<SymbolDraft> getSymbols() { return new ArrayList<>(symbols.values()); }

    List<ReferenceDraft> getReferences() { return references; }

    // --- Imports ---

    @Override
    public boolean visit(ImportDeclaration node) {
        if (node.isOnDemand()) return false;
        references.add(new ReferenceDraft(SymbolIds.MODULE_NAME, 0,
                node.getName().getFullyQualifiedName(), -1,
                RelationKind.IMPORT, ReferenceForm.DIRECT, lineOf(node)));
        return false;
    }

    // --- Types ---

    @Override
    public boolean visit(TypeDeclaration node) { return enterType(node); }

    @Override
    public void endVisit(TypeDeclaration node) { exitType(); }

    @Override
    public boolean visit(EnumDeclaration node) { return enterType(node); }

    @Override
    public void endVisit(EnumDeclaration node) { exitType(); }

    @Override
    public boolean visit(RecordDeclaration node) {
        enterType(node);
        for (Object component : node.recordComponents()) {
            declareVariable((SingleVariableDeclaration) component);
        }
        return true;
    }

    @Override
    public void endVisit(RecordDeclaration node) { exitType(); }

    @Override
    public boolean visit(AnnotationTypeDeclaration node) { return enterType(node); }

    @Override
    public void endVisit(AnnotationTypeDeclaration node) { exitType(); }

    private boolean enterType(AbstractTypeDeclaration node) {
        String simple = node.getName().getIdentifier();
        types.push(types.isEmpty() ? simple : types.peek() + "." + simple);

        // Fields are visible to every method of the type, whatever their declaration order.
        Map<String, String> fields = new HashMap<>();
        for (Object body : node.bodyDeclarations()) {
            if (body instanceof FieldDeclaration) {
                FieldDeclaration field = (FieldDeclaration) body;
                String type = typeName(field.getType());
                for (Object fragment : field.fragments()) {
                    String name = ((VariableDeclarationFragment) fragment).getName().getIdentifier();
                    if (type != null) fields.put(name, type);
                }
            }
        }
        scopes.push(fields);
        return true;
    }

    private void exitType() {
        types.pop();
        scopes.pop();
    }

    // --- Methods ---

    @Override
    public boolean visit(MethodDeclaration node) {
        scopes.push(new HashMap<>());
        for (Object param : node.parameters()) {
            declareVariable((SingleVariableDeclaration) param);
        }
        if (node.getParent() instanceof AnonymousClassDeclaration || types.isEmpty()) {
            // Anonymous class bodies are attributed to the enclosing declaration.
            owners.push(owners.peek());
            return true;
        }

        String name = types.peek() + "." + (node.isConstructor() ? "<init>" : node.getName().getIdentifier());
        int arity = node.parameters().size();
        owners.push(new Owner(name, arity));

        String key = name + "/" + arity;
        if (symbols.containsKey(key)) {
            log.warn("{}: duplicate declaration of {} at line {}; keeping the first", path, key, lineOf(node));
            return true;
        }
        symbols.put(key, new SymbolDraft(name, signatureOf(node, name), arity,
                lineOf(node), endLineOf(node)));
        return true;
    }

    @Override
    public void endVisit(MethodDeclaration node) {
        owners.pop();
        scopes.pop();
    }

    private String signatureOf(MethodDeclaration node, String name) {
        String params = ((List<?>) node.parameters()).stream()
                .map(p -> {
                    SingleVariableDeclaration d = (SingleVariableDeclaration) p;
                    return d.getType() + (d.isVarargs() ? "..." : "");
                })
                .collect(Collectors.joining(", "));
        String returns = node.isConstructor() || node.getReturnType2() == null ? "" : node.getReturnType2() + " ";
        return returns + name + "(" + params + ")";
    }

    // --- Local variable types ---

    @Override
    public boolean visit(VariableDeclarationStatement node) {
        declareFragments(node.getType(), node.fragments());
        return true;
    }

    @Override
    public boolean visit(VariableDeclarationExpression node) {
        declareFragments(node.getType(), node.fragments());
        return true;
    }

    @Override
    public boolean visit(SingleVariableDeclaration node) {
        // Catch clauses and enhanced for loops; parameters were declared with their method.
        if (!(node.getParent() instanceof MethodDeclaration) && !(node.getParent() instanceof RecordDeclaration)) {
            declareVariable(node);
        }
        return true;
    }

    private void declareFragments(Type type, List<?> fragments) {
        for (Object f : fragments) {
            VariableDeclarationFragment fragment = (VariableDeclarationFragment) f;
            String typeName = typeName(type);
            if ("var".equals(typeName) && fragment.getInitializer() instanceof ClassInstanceCreation) {
                typeName = typeName(((ClassInstanceCreation) fragment.getInitializer()).getType());
            }
            if (typeName != null && !"var".equals(typeName) && !scopes.isEmpty()) {
                scopes.peek().put(fragment.getName().getIdentifier(), typeName);
            }
        }
    }

    private void declareVariable(SingleVariableDeclaration decl) {
        String typeName = typeName(decl.getType());
        if (typeName != null && !decl.isVarargs() && !scopes.isEmpty()) {
            scopes.peek().put(decl.getName().getIdentifier(), typeName);
        }
    }

    private String lookupVariable(String name) {
        for (Map<String, String> scope : scopes) {
            String type = scope.get(name);
            if (type != null) return type;
        }
        return null;
    }

    // --- Conditional regions ---

    @Override
    public boolean visit(IfStatement node) {
        node.getExpression().accept(this);
        conditionalDepth++;
        node.getThenStatement().accept(this);
        if (node.getElseStatement() != null) node.getElseStatement().accept(this);
        conditionalDepth--;
        return false;
    }

    @Override
    public boolean visit(ConditionalExpression node) {
        node.getExpression().accept(this);
        conditionalDepth++;
        node.getThenExpression().accept(this);
        node.getElseExpression().accept(this);
        conditionalDepth--;
        return false;
    }

    @Override
    public boolean visit(SwitchStatement node) {
        node.getExpression().accept(this);
        conditionalDepth++;
        for (Object statement : node.statements()) ((ASTNode) statement).accept(this);
        conditionalDepth--;
        return false;
    }

    @Override
    public boolean visit(SwitchExpression node) {
        node.getExpression().accept(this);
        conditionalDepth++;
        for (Object statement : node.statements()) ((ASTNode) statement).accept(this);
        conditionalDepth--;
        return false;
    }

    @Override
    public boolean visit(CatchClause node) {
        conditionalDepth++;
        return true;
    }

    @Override
    public void endVisit(CatchClause node) {
        conditionalDepth--;
    }

    @Override
    public boolean visit(InfixExpression node) {
        InfixExpression.Operator op = node.getOperator();
        if (op != InfixExpression.Operator.CONDITIONAL_AND && op != InfixExpression.Operator.CONDITIONAL_OR) {
            return true;
        }
        node.getLeftOperand().accept(this);
        conditionalDepth++;
        node.getRightOperand().accept(this);
        for (Object operand : node.extendedOperands()) ((ASTNode) operand).accept(this);
        conditionalDepth--;
        return false;
    }

    // --- References ---

    @Override
    public boolean visit(MethodInvocation node) {
        String name = node.getName().getIdentifier();
        List<?> args = node.arguments();

        String reflective = reflectiveTarget(node, name, args);
        if (reflective != null) {
            addReference(reflective, -1, RelationKind.CALL, ReferenceForm.DYNAMIC, node);
        }
        addReference(qualify(node.getExpression(), name), args.size(), RelationKind.CALL, currentForm(), node);
        return true;
    }

    @Override
    public boolean visit(SuperMethodInvocation node) {
        addReference(node.getName().getIdentifier(), node.arguments().size(), RelationKind.CALL, currentForm(), node);
        return true;
    }

    @Override
    public boolean visit(ClassInstanceCreation node) {
        String type = typeName(node.getType());
        if (type != null) {
            addReference(type + ".<init>", node.arguments().size(), RelationKind.CALL, currentForm(), node);
        }
        return true;
    }

    @Override
    public boolean visit(ConstructorInvocation node) {
        if (!types.isEmpty()) {
            addReference(types.peek() + ".<init>", node.arguments().size(), RelationKind.CALL, currentForm(), node);
        }
        return true;
    }

    @Override
    public boolean visit(ExpressionMethodReference node) {
        addReference(qualify(node.getExpression(), node.getName().getIdentifier()), -1,
                RelationKind.COMPOSE, currentForm(), node);
        return true;
    }

    @Override
    public boolean visit(TypeMethodReference node) {
        String type = typeName(node.getType());
        String name = node.getName().getIdentifier();
        addReference(type != null ? type + "." + name : name, -1, RelationKind.COMPOSE, currentForm(), node);
        return true;
    }

    @Override
    public boolean visit(CreationReference node) {
        String type = typeName(node.getType());
        if (type != null) {
            addReference(type + ".<init>", -1, RelationKind.COMPOSE, currentForm(), node);
        }
        return true;
    }

    /**
     * {@code Foo.class.getMethod("bar")} or {@code lookup.findVirtual(Foo.class, "bar", type)} name
     * their target in a string; the reference is recorded as dynamic.
     */
    private String reflectiveTarget(MethodInvocation node, String name, List<?> args) {
        Expression literal = null;
        String owner = null;
        if (REFLECTIVE_LOOKUPS.contains(name) && !args.isEmpty()) {
            literal = (Expression) args.get(0);
            if (node.getExpression() instanceof TypeLiteral) {
                owner = typeName(((TypeLiteral) node.getExpression()).getType());
            }
        } else if (HANDLE_LOOKUPS.contains(name) && args.size() >= 2) {
            literal = (Expression) args.get(1);
            if (args.get(0) instanceof TypeLiteral) {
                owner = typeName(((TypeLiteral) args.get(0)).getType());
            }
        }
        if (!(literal instanceof StringLiteral)) return null;
        String target = ((StringLiteral) literal).getLiteralValue();
        return owner != null ? owner + "." + target : target;
    }

    /** Names a call target the way the source qualifies it, using declared types where known. */
    private String qualify(Expression receiver, String name) {
        if (receiver == null || receiver instanceof ThisExpression) {
            return types.isEmpty() ? name : types.peek() + "." + name;
        }
        if (receiver instanceof SimpleName) {
            String identifier = ((SimpleName) receiver).getIdentifier();
            String type = lookupVariable(identifier);
            if (type != null) return type + "." + name;
            if (Character.isUpperCase(identifier.charAt(0))) return identifier + "." + name;
            return name;
        }
        if (receiver instanceof FieldAccess && ((FieldAccess) receiver).getExpression() instanceof ThisExpression) {
            String type = lookupVariable(((FieldAccess) receiver).getName().getIdentifier());
            return type != null ? type + "." + name : name;
        }
        if (receiver instanceof ClassInstanceCreation) {
            String type = typeName(((ClassInstanceCreation) receiver).getType());
            return type != null ? type + "." + name : name;
        }
        if (receiver instanceof QualifiedName) {
            String last = ((QualifiedName) receiver).getName().getIdentifier();
            if (Character.isUpperCase(last.charAt(0))) return last + "." + name;
        }
        return name;
    }

    private void addReference(String target, int arity, RelationKind kind, ReferenceForm form, ASTNode node) {
        Owner owner = owners.peek();
        references.add(new ReferenceDraft(owner.name(), owner.arity(), target, arity, kind, form, lineOf(node)));
    }

    private ReferenceForm currentForm() {
        return conditionalDepth > 0 ? ReferenceForm.CONDITIONAL : ReferenceForm.DIRECT;
    }

    // --- Helpers ---

    /** Simple name of a class type, ignoring type arguments; null for primitives and arrays. */
    private static String typeName(Type type) {
        if (type == null) return null;
        if (type instanceof ParameterizedType) return typeName(((ParameterizedType) type).getType());
        if (type instanceof SimpleType) return simple(((SimpleType) type).getName());
        if (type instanceof QualifiedType) return ((QualifiedType) type).getName().getIdentifier();
        if (type instanceof NameQualifiedType) return ((NameQualifiedType) type).getName().getIdentifier();
        return null;
    }

    private static String simple(Name name) {
        return name.isSimpleName()
                ? ((SimpleName) name).getIdentifier()
                : ((QualifiedName) name).getName().getIdentifier();
    }

    private int lineOf(ASTNode node) {
        return cu.getLineNumber(node.getStartPosition());
    }

    private int endLineOf(ASTNode node) {
        return cu.getLineNumber(node.getStartPosition() + node.getLength() - 1);
    }
}
