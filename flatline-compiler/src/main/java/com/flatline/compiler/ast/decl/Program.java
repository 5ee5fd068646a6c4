package com.flatline.compiler.ast.decl;

import com.flatline.compiler.ast.AstNode;
import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译单元（一个源文件）
 */
public class Program extends AstNode {
    private final String fileName;
    private final List<Declaration> declarations;

    public Program(SourceLocation location, String fileName, List<Declaration> declarations) {
        super(location);
        this.fileName = fileName;
        this.declarations = Collections.unmodifiableList(new ArrayList<Declaration>(declarations));
    }

    public String getFileName() {
        return fileName;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    /** 按名字查找顶层函数（第一个匹配） */
    public FunDecl findFunction(String name) {
        for (Declaration d : declarations) {
            if (d instanceof FunDecl && name.equals(d.getName())) {
                return (FunDecl) d;
            }
        }
        return null;
    }

    public ClassDecl findClass(String name) {
        for (Declaration d : declarations) {
            if (d instanceof ClassDecl && name.equals(d.getName())) {
                return (ClassDecl) d;
            }
        }
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
