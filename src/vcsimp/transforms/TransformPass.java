package vcsimp.transforms;

import vcsimp.hir.GlobalEnv;
import vcsimp.hir.PrintTools;
import vcsimp.hir.Tools;

/**
* Base class of the passes that rewrite a batch of verification conditions
* declared against one environment.
*/
public abstract class TransformPass {

    /** The declarations the verification conditions refer to */
    protected GlobalEnv env;

    /** Constructs a transform pass over the given environment */
    protected TransformPass(GlobalEnv env) {
        this.env = env;
    }

    /** Returns the name of the transform pass */
    public abstract String getPassName();

    /**
    * Invokes the specified transform pass.
    * @param pass the transform pass that is to be run.
    */
    public static void run(TransformPass pass) {
        double timer = Tools.getTime();
        PrintTools.printlnStatus(pass.getPassName() + " begin", 1);
        pass.start();
        PrintTools.printlnStatus(pass.getPassName() + " end in " +
                String.format("%.2f seconds", Tools.getTime(timer)), 1);
    }

    /** Starts a transform pass */
    public abstract void start();

}
