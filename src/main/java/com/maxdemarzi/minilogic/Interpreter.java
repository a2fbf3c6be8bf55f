package com.maxdemarzi.minilogic;

import com.maxdemarzi.minilogic.ast.*;
import com.maxdemarzi.minilogic.compile.FunctionTableCompiler;
import com.maxdemarzi.minilogic.quine.ExpressionedTruthTable;
import com.maxdemarzi.minilogic.quine.Minimizer;
import com.maxdemarzi.minilogic.runtime.*;
import com.maxdemarzi.minilogic.show.ExpressionPrinter;
import com.maxdemarzi.minilogic.show.TruthTableRenderer;
import org.neo4j.logging.Log;
import org.neo4j.logging.NullLog;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Runs a parsed program once, in order, and collects what PRINT, SHOW and TABLE produce.
 * The first failing statement aborts the run.
 */
public class Interpreter {
    // Room for the default call depth on nested function bodies
    private static final long WORKER_STACK_SIZE = 64L * 1024 * 1024;

    private final List<Statement> program;
    private final Settings settings;
    private final Log log;

    private final Environment environment = new Environment();
    private final Evaluator evaluator;
    private final ExpressionPrinter printer;
    private final List<String> output = new ArrayList<>();
    private boolean started;

    public Interpreter(List<Statement> program, InputSource input, Settings settings, Log log) {
        this.program = List.copyOf(program);
        this.settings = settings;
        this.log = log;
        this.evaluator = new Evaluator(environment, input, log, settings.getMaxCallDepth());
        this.printer = new ExpressionPrinter(evaluator, new Minimizer(log), settings.isInlineFunctions());
    }

    public Interpreter(List<Statement> program, InputSource input) {
        this(program, input, Settings.defaults(), NullLog.getInstance());
    }

    public Interpreter(List<Statement> program) {
        this(program, InputSource.NONE);
    }

    public synchronized List<String> run() {
        if (started) {
            throw new IllegalStateException("An interpreter runs its program only once");
        }
        started = true;

        Execute execute = new Execute();
        for (Statement statement : program) {
            log.debug("Executing %s", statement);
            try {
                statement.accept(execute);
            } catch (MiniLogicException e) {
                e.attach(statement);
                log.error("Run aborted at %s: %s", statement, e.getMessage());
                throw e;
            }
        }
        return List.copyOf(output);
    }

    // Runs on a dedicated thread so a caller answering INPUT requests is never blocked
    public CompletableFuture<List<String>> execute() {
        ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(null, r, "minilogic-run", WORKER_STACK_SIZE);
            thread.setDaemon(true);
            return thread;
        });
        return CompletableFuture.supplyAsync(this::run, worker)
                .whenComplete((result, error) -> worker.shutdown());
    }

    public Environment getEnvironment() {
        return environment;
    }

    private class Execute implements StatementVisitor<Void> {

        @Override
        public Void visitVariable(VariableDeclaration declaration) {
            environment.checkVariableName(declaration.getName(), declaration);
            environment.declareVariable(declaration.getName(), evaluator.evaluate(declaration.getValue()), declaration);
            log.debug("Declared variable %s", declaration.getName());
            return null;
        }

        @Override
        public Void visitFunction(FunctionDeclaration declaration) {
            environment.declareFunction(declaration, declaration);
            log.debug("Declared function %s/%d", declaration.getName(), declaration.getParameters().size());
            return null;
        }

        @Override
        public Void visitFunctionTable(FunctionTableDeclaration declaration) {
            environment.checkFunctionName(declaration.getName(), declaration);
            FunctionDeclaration compiled = FunctionTableCompiler.compile(declaration);
            environment.declareFunction(compiled, declaration);
            log.debug("Declared function %s/%d from a table of %d rows", declaration.getName(),
                    compiled.getParameters().size(), declaration.getRows().size());
            return null;
        }

        @Override
        public Void visitBuiltin(BuiltinStatement statement) {
            Builtin builtin = statement.getBuiltin();
            List<Expression> parameters = statement.getParameters();
            if (!builtin.isSupported()) {
                throw new UnsupportedBuiltinException(builtin, statement);
            }

            switch (builtin) {
                case PRINT:
                    output.add(parameters.stream()
                            .map(this::print)
                            .collect(Collectors.joining(settings.getPrintSeparator())));
                    break;
                case SHOW:
                    output.add(parameters.stream()
                            .map(printer::show)
                            .collect(Collectors.joining(settings.getPrintSeparator())));
                    break;
                case TABLE:
                    output.add(parameters.stream()
                            .map(this::table)
                            .collect(Collectors.joining("\n")));
                    break;
                default:
                    throw new MiniLogicException(ErrorKind.UNSUPPORTED_OPERATION,
                            "Invalid builtin " + builtin + " as statement", statement);
            }
            return null;
        }

        @Override
        public Void visitError(ErrorStatement error) {
            throw new MiniLogicException(ErrorKind.GRAMMAR_CONTRACT, error.getMessage(), error);
        }

        private String print(Expression parameter) {
            if (parameter instanceof StringLiteral) {
                return ((StringLiteral) parameter).getValue();
            }
            return evaluator.evaluate(parameter).toString();
        }

        private String table(Expression parameter) {
            ExpressionedTruthTable table = new ExpressionedTruthTable(parameter, evaluator).compute();
            return TruthTableRenderer.render(table, printer.show(parameter));
        }
    }
}
