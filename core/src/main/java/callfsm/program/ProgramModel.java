package callfsm.program;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Control and call structure of a program: the input of the automaton builders.
 *
 * <p>Functions keep the order in which they were added.
 */
public final class ProgramModel {

  /**
   * Name of the program (for bytecode, the name of the first class read).
   */
  public final String name;

  private final Map<String, FunctionModel> functions;

  public ProgramModel(String name, Collection<FunctionModel> functions) {
    this.name = name;
    final var byId = new LinkedHashMap<String, FunctionModel>();
    for (FunctionModel function : functions) {
      if (byId.put(function.id(), function) != null) {
        throw new IllegalArgumentException("duplicate function " + function.id());
      }
    }
    this.functions = Collections.unmodifiableMap(byId);
  }

  /**
   * All functions, declarations included.
   */
  public Collection<FunctionModel> functions() {
    return functions.values();
  }

  /**
   * Look up a function which has a body in the program.
   *
   * @param id function identifier
   * @return the function if it is defined in the program
   */
  public Optional<FunctionModel> definedFunction(String id) {
    return Optional
      .ofNullable(functions.get(id))
      .filter(function -> !function.isDeclaration());
  }

  /**
   * Find the defined function where execution starts.
   *
   * @param simpleName name of the function, without its owner
   * @return first defined function with that name
   * @throws IllegalArgumentException if there is no such function
   */
  public FunctionModel entryFunction(String simpleName) {
    return functions
      .values()
      .stream()
      .filter(function -> !function.isDeclaration() && function.simpleName().equals(simpleName))
      .findFirst()
      .orElseThrow(() -> new IllegalArgumentException("no entry function '" + simpleName + "' in " + name));
  }
}
