package parallelizer;

/** Basic error class in this project. */
public class ParallelizerError extends RuntimeException {

  public ParallelizerError(Exception wrapped) {
    super(wrapped);
  }

  public ParallelizerError(String message) {
    super(message);
  }

  public ParallelizerError(String message, Throwable cause) {
    super(message, cause);
  }
}
