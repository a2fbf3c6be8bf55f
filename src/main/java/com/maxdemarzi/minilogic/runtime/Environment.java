package com.maxdemarzi.minilogic.runtime;

import com.maxdemarzi.minilogic.ast.Bit;
import com.maxdemarzi.minilogic.ast.FunctionDeclaration;
import com.maxdemarzi.minilogic.ast.Statement;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.map.mutable.UnifiedMap;

import java.util.Map;

/**
 * Global variables and functions of one run. Names are written once and never removed.
 */
public class Environment {
    private final MutableMap<String, Bit> variables = UnifiedMap.newMap();
    private final MutableMap<String, FunctionDeclaration> functions = UnifiedMap.newMap();

    public void declareVariable(String name, Bit value, Statement declaration) {
        checkVariableName(name, declaration);
        variables.put(name, value);
    }

    // Checked before the initializer runs, so a taken name never triggers an INPUT request
    public void checkVariableName(String name, Statement declaration) {
        if (variables.containsKey(name)) {
            throw new MiniLogicException(ErrorKind.DECLARATION_CONFLICT,
                    "Variable " + name + " already defined", declaration);
        }
        if (functions.containsKey(name)) {
            throw new MiniLogicException(ErrorKind.DECLARATION_CONFLICT,
                    "Ambiguous variable name " + name + ", already used as function", declaration);
        }
    }

    // Checked separately from declareFunction so a table is not compiled for a name that is taken
    public void checkFunctionName(String name, Statement declaration) {
        if (functions.containsKey(name)) {
            throw new MiniLogicException(ErrorKind.DECLARATION_CONFLICT,
                    "Function " + name + " already defined", declaration);
        }
        if (variables.containsKey(name)) {
            throw new MiniLogicException(ErrorKind.DECLARATION_CONFLICT,
                    "Ambiguous function name " + name + ", already used as variable", declaration);
        }
    }

    public void declareFunction(FunctionDeclaration function, Statement declaration) {
        checkFunctionName(function.getName(), declaration);
        functions.put(function.getName(), function);
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public Bit getVariable(String name) {
        return variables.get(name);
    }

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    public FunctionDeclaration getFunction(String name) {
        return functions.get(name);
    }

    public Map<String, Bit> getVariables() {
        return variables.asUnmodifiable();
    }

    public Map<String, FunctionDeclaration> getFunctions() {
        return functions.asUnmodifiable();
    }
}
