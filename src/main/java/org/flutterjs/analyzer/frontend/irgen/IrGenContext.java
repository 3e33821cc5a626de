package org.flutterjs.analyzer.frontend.irgen;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.diagnostics.DiagnosticsEngine;
import org.flutterjs.analyzer.frontend.parser.ast.AstNode;
import org.flutterjs.analyzer.frontend.semantics.TypeDescriptor;
import org.flutterjs.analyzer.frontend.semantics.TypeResolver;
import org.flutterjs.analyzer.frontend.semantics.TypeRoles;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.flutterjs.analyzer.ir.DeclarationIds;
import org.flutterjs.analyzer.ir.ExportDeclaration;
import org.flutterjs.analyzer.ir.FileDeclaration;
import org.flutterjs.analyzer.ir.FunctionDeclaration;
import org.flutterjs.analyzer.ir.ImportDeclaration;
import org.flutterjs.analyzer.ir.PlainTypeDeclaration;
import org.flutterjs.analyzer.ir.StateHolderDeclaration;
import org.flutterjs.analyzer.ir.VariableDeclaration;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context passed to converters while one file is extracted.
 * Collects the declarations of the file, gives access to diagnostics and to the
 * read-only project view, and hands out stable declaration ids.
 */
public final class IrGenContext {

	private final AnalysisContext analysis;
	private final DiagnosticsEngine diagnostics;
	private final IrConverterRegistry registry;
	private final TypeResolver typeResolver;

	private String libraryName;
	private String partOf;
	private final List<ImportDeclaration> imports = new ArrayList<>();
	private final List<ExportDeclaration> exports = new ArrayList<>();
	private final List<String> parts = new ArrayList<>();
	private final List<ComponentDeclaration> components = new ArrayList<>();
	private final List<StateHolderDeclaration> stateHolders = new ArrayList<>();
	private final List<PlainTypeDeclaration> plainTypes = new ArrayList<>();
	private final List<FunctionDeclaration> functions = new ArrayList<>();
	private final List<VariableDeclaration> variables = new ArrayList<>();

	/**
	 * Constructs a new IR generation context.
	 * @param analysis The read-only project view for the current file.
	 * @param diagnostics The diagnostics engine for reporting errors and warnings.
	 * @param registry The registry for resolving AST node converters.
	 */
	public IrGenContext(AnalysisContext analysis, DiagnosticsEngine diagnostics, IrConverterRegistry registry) {
		this.analysis = analysis;
		this.diagnostics = diagnostics;
		this.registry = registry;
		this.typeResolver = new TypeResolver(analysis.registry());
	}

	/**
	 * Converts the given AST node by resolving and invoking the appropriate converter.
	 * @param node The node to convert.
	 */
	public void convert(AstNode node) {
		registry.resolve(node).convert(node, this);
	}

	public DiagnosticsEngine diagnostics() {
		return diagnostics;
	}

	public AnalysisContext analysis() {
		return analysis;
	}

	public FileIdentity file() {
		return analysis.file();
	}

	/**
	 * Looks up the UI roles of a type declared in the current file. The registry entry is used
	 * when it belongs to this file; otherwise the roles are derived from the given supertypes.
	 *
	 * @param name       The declared type name.
	 * @param supertype  Its superclass name, may be {@code null}.
	 * @param mixins     Its mixins.
	 * @param interfaces Its interfaces.
	 * @return The roles.
	 */
	public TypeRoles rolesOf(String name, String supertype, List<String> mixins, List<String> interfaces) {
		return analysis.registry().lookup(name)
				.filter(d -> d.file().equals(file()))
				.map(TypeDescriptor::roles)
				.orElseGet(() -> typeResolver.rolesOf(supertype, mixins, interfaces));
	}

	/**
	 * @param name A top-level declaration name.
	 * @return The stable id of that declaration in the current file.
	 */
	public String declarationId(String name) {
		return DeclarationIds.of(file(), name);
	}

	/**
	 * @param owner  The enclosing type name.
	 * @param member The member name; setters carry a trailing {@code =}.
	 * @return The stable id of the member.
	 */
	public String memberId(String owner, String member) {
		return DeclarationIds.of(file(), owner + "." + member);
	}

	public void libraryName(String name) {
		this.libraryName = name;
	}

	public void partOf(String library) {
		this.partOf = library;
	}

	public void addImport(ImportDeclaration declaration) {
		imports.add(declaration);
	}

	public void addExport(ExportDeclaration declaration) {
		exports.add(declaration);
	}

	public void addPart(String uri) {
		parts.add(uri);
	}

	public void addComponent(ComponentDeclaration declaration) {
		components.add(declaration);
	}

	public void addStateHolder(StateHolderDeclaration declaration) {
		stateHolders.add(declaration);
	}

	public void addPlainType(PlainTypeDeclaration declaration) {
		plainTypes.add(declaration);
	}

	public void addFunction(FunctionDeclaration declaration) {
		functions.add(declaration);
	}

	public void addVariable(VariableDeclaration declaration) {
		variables.add(declaration);
	}

	/**
	 * Builds the final {@link FileDeclaration} from the collected declarations.
	 * @return The per-file IR.
	 */
	public FileDeclaration build() {
		return new FileDeclaration(file(), libraryName, partOf, imports, exports, parts, components, stateHolders,
				plainTypes, functions, variables);
	}
}
