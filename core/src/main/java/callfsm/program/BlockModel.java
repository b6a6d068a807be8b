package callfsm.program;

import java.util.List;

/**
 * Basic block of a function.
 *
 * @param index position of the block in its function (the entry block is {@code 0})
 * @param calls call instructions, in program order
 * @param successors indices of the blocks control may flow to after this one
 * @param returns whether the block ends by returning from the function
 */
public record BlockModel(
  int index,
  List<CallSite> calls,
  List<Integer> successors,
  boolean returns
) {

  public BlockModel {
    calls = List.copyOf(calls);
    successors = List.copyOf(successors);
  }
}
