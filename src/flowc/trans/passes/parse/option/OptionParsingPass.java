package flowc.trans.passes.parse.option;

import flowc.FlowcOptionException;
import flowc.FlowcOptions;
import flowc.errors.IssueContext;

import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static FlowcOptions perform(IssueContext ctx, Logger logger, String[] args, Map<String, String> environment) {
		FlowcOptions opts = new FlowcOptions(args);
		try {
			opts.parse(environment);
		} catch (FlowcOptionException e) {
			ctx.error(new OptionParserIssue(e.getMsg()));
		}
		// set the logger's log level based on command line arguments
		Level level;
		if (opts.logLvlQuiet) {
			level = Level.WARNING;
		} else if (opts.logLvlVerbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		if (level.intValue() < Level.INFO.intValue()) {
			// the default console handler drops anything below INFO
			for (Handler handler : Logger.getLogger("").getHandlers()) {
				handler.setLevel(level);
			}
		}
		return opts;
	}
}
