package com.flatline.compiler.ast.stmt;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.decl.PropertyDecl;

/**
 * 局部变量声明语句
 */
public class DeclarationStmt extends Statement {
    private final PropertyDecl declaration;

    public DeclarationStmt(SourceLocation location, PropertyDecl declaration) {
        super(location);
        this.declaration = declaration;
    }

    public PropertyDecl getDeclaration() {
        return declaration;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeclarationStmt(this, context);
    }
}
