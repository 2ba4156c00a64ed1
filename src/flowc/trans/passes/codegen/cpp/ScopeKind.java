package flowc.trans.passes.codegen.cpp;

public enum ScopeKind {
	MAIN,
	FUNCTION,
	BLOCK,
}
