package exm.iulia.common.exceptions;

/**
 * This represents an optimizer internal error.
 * These always indicate a bug in the optimizer or input that violates
 * the contract of a pass (e.g. an identifier that does not resolve).
 * */
public class IuliaRuntimeError extends RuntimeException
{
  public IuliaRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
