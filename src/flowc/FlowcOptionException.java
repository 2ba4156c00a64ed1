package flowc;

public class FlowcOptionException extends FlowcException {

	private static final long serialVersionUID = 4260519842203371958L;
	private static final String prefix = "Option Error";

	public FlowcOptionException(String msg) {
		super(prefix, msg);
	}

	public FlowcOptionException(String msg, Throwable cause) {
		super(prefix, msg, cause);
	}
}
