package daddy.trans.passes.scope;

import daddy.errors.IssueContext;
import daddy.model.pygmy.PygmyDeclaration;
import daddy.model.pygmy.PygmyModule;
import daddy.model.pygmy.PygmyUnit;

public class PygmyScopingPass {
	private PygmyScopingPass() {}

	public static PygmyModule perform(IssueContext ctx, PygmyUnit unit) {
		PygmyModuleBuilder builder = new PygmyModuleBuilder(ctx);
		for (PygmyDeclaration declaration : unit.getDeclarations()) {
			declaration.accept(builder);
		}
		return builder.build(unit.getLocation());
	}
}
