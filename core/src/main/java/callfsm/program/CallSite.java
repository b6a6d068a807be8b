package callfsm.program;

import java.util.OptionalLong;

/**
 * Call instruction inside a basic block.
 *
 * @param calleeId unique identifier of the called function (matches {@link FunctionModel#id()})
 * @param calleeName human readable name of the called function, used in labels
 * @param constantArgument value of the first argument, if it is a known constant
 */
public record CallSite(
  String calleeId,
  String calleeName,
  OptionalLong constantArgument
) {

  public CallSite(String calleeId, String calleeName) {
    this(calleeId, calleeName, OptionalLong.empty());
  }

  /**
   * Name of the called function without its owner.
   */
  public String calleeSimpleName() {
    return FunctionModel.simpleName(calleeName);
  }
}
