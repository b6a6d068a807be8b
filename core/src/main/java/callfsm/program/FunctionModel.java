package callfsm.program;

import java.util.List;

/**
 * Function of the analyzed program.
 *
 * @param id unique identifier (for bytecode: owner, name and descriptor)
 * @param name human readable name, used in labels
 * @param blocks basic blocks, entry block first; empty for external declarations
 */
public record FunctionModel(
  String id,
  String name,
  List<BlockModel> blocks
) {

  public FunctionModel {
    blocks = List.copyOf(blocks);
    for (int i = 0; i < blocks.size(); i++) {
      if (blocks.get(i).index() != i) {
        throw new IllegalArgumentException("block " + i + " of " + name + " has index " + blocks.get(i).index());
      }
    }
  }

  /**
   * Is this function only declared (its body is not part of the program)?
   */
  public boolean isDeclaration() {
    return blocks.isEmpty();
  }

  public BlockModel entry() {
    if (isDeclaration()) {
      throw new IllegalStateException(name + " has no body");
    }
    return blocks.get(0);
  }

  public String simpleName() {
    return simpleName(name);
  }

  static String simpleName(String name) {
    return name.substring(name.lastIndexOf('.') + 1);
  }
}
