/*
 * Copyright 2026 The go-table-converter Authors
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.tableconv.goConverter.converter.frontend;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.tableconv.goConverter.converter.errors.SourceFileContents;
import org.tableconv.goConverter.converter.errors.SyntaxError;
import org.tableconv.goConverter.ir.GoDeclaration;
import org.tableconv.goConverter.ir.GoExpression;
import org.tableconv.goConverter.ir.GoFile;
import org.tableconv.goConverter.ir.GoNode;
import org.tableconv.goConverter.ir.GoSpec;
import org.tableconv.goConverter.ir.GoStatement;
import org.tableconv.goConverter.ir.declaration.GoFuncDecl;
import org.tableconv.goConverter.ir.declaration.GoGenDecl;
import org.tableconv.goConverter.ir.declaration.GoImportSpec;
import org.tableconv.goConverter.ir.declaration.GoTypeSpec;
import org.tableconv.goConverter.ir.declaration.GoValueSpec;
import org.tableconv.goConverter.ir.expression.GoBasicLit;
import org.tableconv.goConverter.ir.expression.GoBinaryExpr;
import org.tableconv.goConverter.ir.expression.GoCallExpr;
import org.tableconv.goConverter.ir.expression.GoCompositeLit;
import org.tableconv.goConverter.ir.expression.GoEllipsis;
import org.tableconv.goConverter.ir.expression.GoFuncLit;
import org.tableconv.goConverter.ir.expression.GoIdent;
import org.tableconv.goConverter.ir.expression.GoIndexExpr;
import org.tableconv.goConverter.ir.expression.GoKeyValueExpr;
import org.tableconv.goConverter.ir.expression.GoParenExpr;
import org.tableconv.goConverter.ir.expression.GoSelectorExpr;
import org.tableconv.goConverter.ir.expression.GoSliceExpr;
import org.tableconv.goConverter.ir.expression.GoStarExpr;
import org.tableconv.goConverter.ir.expression.GoTypeAssertExpr;
import org.tableconv.goConverter.ir.expression.GoUnaryExpr;
import org.tableconv.goConverter.ir.statement.GoAssignStmt;
import org.tableconv.goConverter.ir.statement.GoBlockStmt;
import org.tableconv.goConverter.ir.statement.GoBranchStmt;
import org.tableconv.goConverter.ir.statement.GoCaseClause;
import org.tableconv.goConverter.ir.statement.GoCommClause;
import org.tableconv.goConverter.ir.statement.GoDeclStmt;
import org.tableconv.goConverter.ir.statement.GoDeferStmt;
import org.tableconv.goConverter.ir.statement.GoEmptyStmt;
import org.tableconv.goConverter.ir.statement.GoExprStmt;
import org.tableconv.goConverter.ir.statement.GoForStmt;
import org.tableconv.goConverter.ir.statement.GoGoStmt;
import org.tableconv.goConverter.ir.statement.GoIfStmt;
import org.tableconv.goConverter.ir.statement.GoIncDecStmt;
import org.tableconv.goConverter.ir.statement.GoLabeledStmt;
import org.tableconv.goConverter.ir.statement.GoRangeStmt;
import org.tableconv.goConverter.ir.statement.GoReturnStmt;
import org.tableconv.goConverter.ir.statement.GoSelectStmt;
import org.tableconv.goConverter.ir.statement.GoSendStmt;
import org.tableconv.goConverter.ir.statement.GoSwitchStmt;
import org.tableconv.goConverter.ir.statement.GoTypeSwitchStmt;
import org.tableconv.goConverter.ir.type.GoArrayType;
import org.tableconv.goConverter.ir.type.GoChanType;
import org.tableconv.goConverter.ir.type.GoField;
import org.tableconv.goConverter.ir.type.GoFuncType;
import org.tableconv.goConverter.ir.type.GoInterfaceType;
import org.tableconv.goConverter.ir.type.GoMapType;
import org.tableconv.goConverter.ir.type.GoStructType;
import org.tableconv.util.Linq;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the syntax tree of a Go file from the ANTLR parse tree.
 * Every node records the exact range of source characters it spans;
 * a node ends with its last token, not with the newline that terminates it.
 * Comments are not represented.
 *
 * <p>Expressions and simple statements are labeled alternatives in the grammar,
 * and are dispatched through the generated visitor.  The other rules are
 * translated by the typed methods below.
 */
public class GoTreeBuilder extends GoParserBaseVisitor<GoNode> {
    final GoSourceTokens tokens;
    final SourceFileContents contents;

    public GoTreeBuilder(GoSourceTokens tokens) {
        this.tokens = tokens;
        this.contents = tokens.contents;
    }

    // Positions

    int start(ParserRuleContext context) {
        return this.tokens.startOf(context.getStart());
    }

    int start(TerminalNode node) {
        return this.tokens.startOf(node.getSymbol());
    }

    int end(TerminalNode node) {
        return this.tokens.endOf(node.getSymbol());
    }

    /** Offset just past the last token of the context, not counting a newline
     * which ends a statement. */
    int end(ParserRuleContext context) {
        int first = context.getStart().getTokenIndex();
        int index = context.getStop().getTokenIndex();
        while (index > first) {
            Token token = this.tokens.get(index);
            if (token.getChannel() == Token.DEFAULT_CHANNEL && token.getType() != GoLexer.EOS)
                break;
            index--;
        }
        return this.tokens.endOf(this.tokens.get(index));
    }

    SyntaxError error(String message, int start, int end) {
        return new SyntaxError(message, this.contents.rangeOf(start, Math.max(end, start + 1)));
    }

    // File and declarations

    public GoFile build(GoParser.SourceFileContext context) {
        GoIdent packageName = this.ident(context.packageClause().IDENTIFIER());
        List<GoDeclaration> declarations = Linq.map(context.declaration(), this::declaration);
        return new GoFile(0, this.contents.text.length(), packageName, declarations, this.tokens);
    }

    GoIdent ident(TerminalNode identifier) {
        return new GoIdent(this.start(identifier), this.end(identifier), identifier.getText());
    }

    List<GoIdent> identifiers(GoParser.IdentifierListContext context) {
        return Linq.map(context.IDENTIFIER(), this::ident);
    }

    GoDeclaration declaration(GoParser.DeclarationContext context) {
        if (context.genDecl() != null)
            return this.genDecl(context.genDecl());
        return this.functionDecl(context.functionDecl());
    }

    GoGenDecl genDecl(GoParser.GenDeclContext context) {
        String keyword = context.keyword.getText();
        List<GoSpec> specs = new ArrayList<>();
        for (GoParser.ImportSpecContext spec: context.importSpec())
            specs.add(this.importSpec(spec));
        for (GoParser.ValueSpecContext spec: context.valueSpec())
            specs.add(this.valueSpec(spec, keyword));
        for (GoParser.TypeSpecContext spec: context.typeSpec())
            specs.add(this.typeSpec(spec));
        return new GoGenDecl(this.start(context), this.end(context), keyword, context.L_PAREN() != null, specs);
    }

    GoImportSpec importSpec(GoParser.ImportSpecContext context) {
        GoIdent name = null;
        if (context.alias != null)
            name = new GoIdent(this.tokens.startOf(context.alias), this.tokens.endOf(context.alias),
                    context.alias.getText());
        return new GoImportSpec(this.start(context), this.end(context), name, this.string(context.string_()));
    }

    GoValueSpec valueSpec(GoParser.ValueSpecContext context, String keyword) {
        GoExpression type = context.type_() == null ? null : this.type(context.type_());
        List<GoExpression> values = context.expressionList() == null
                ? new ArrayList<>() : this.expressions(context.expressionList());
        return new GoValueSpec(this.start(context), this.end(context), keyword,
                this.identifiers(context.identifierList()), type, values);
    }

    GoTypeSpec typeSpec(GoParser.TypeSpecContext context) {
        return new GoTypeSpec(this.start(context), this.end(context), this.ident(context.IDENTIFIER()),
                this.typeParameters(context.typeParameters()), context.ASSIGN() != null,
                this.type(context.type_()));
    }

    GoFuncDecl functionDecl(GoParser.FunctionDeclContext context) {
        List<GoField> receiver = context.receiver == null
                ? new ArrayList<>() : this.parameters(context.receiver);
        GoParser.SignatureContext signature = context.signature();
        GoFuncType type = new GoFuncType(this.start(context), this.end(signature),
                this.typeParameters(context.typeParameters()),
                this.parameters(signature.parameters()), this.results(signature.result()));
        GoBlockStmt body = context.block() == null ? null : this.block(context.block());
        return new GoFuncDecl(this.start(context), this.end(context), receiver,
                this.ident(context.IDENTIFIER()), type, body);
    }

    // Field lists

    /** One entry of a parameter list before grouping: an optional name and a type. */
    record ParameterEntry(@Nullable GoIdent name, GoExpression type) {}

    List<GoField> parameters(GoParser.ParametersContext context) {
        List<ParameterEntry> entries = new ArrayList<>();
        for (GoParser.ParameterDeclContext parameter: context.parameterDecl()) {
            GoIdent name = parameter.IDENTIFIER() == null ? null : this.ident(parameter.IDENTIFIER());
            GoExpression type = this.type(parameter.type_());
            if (parameter.ELLIPSIS() != null)
                type = new GoEllipsis(this.start(parameter.ELLIPSIS()), type.end, type);
            entries.add(new ParameterEntry(name, type));
        }
        return this.groupParameters(entries);
    }

    /** In 'a, b int, c string' the entries a and b are names sharing the following type. */
    List<GoField> groupParameters(List<ParameterEntry> entries) {
        List<GoField> result = new ArrayList<>();
        boolean named = false;
        for (ParameterEntry entry: entries)
            named = named || entry.name() != null;
        if (!named) {
            for (ParameterEntry entry: entries)
                result.add(new GoField(entry.type().start, entry.type().end,
                        new ArrayList<>(), entry.type(), null));
            return result;
        }
        List<GoIdent> pending = new ArrayList<>();
        for (ParameterEntry entry: entries) {
            if (entry.name() == null) {
                GoIdent name = entry.type().as(GoIdent.class);
                if (name == null)
                    throw this.error("mixed named and unnamed parameters", entry.type().start, entry.type().end);
                pending.add(name);
                continue;
            }
            pending.add(entry.name());
            result.add(new GoField(pending.get(0).start, entry.type().end, pending, entry.type(), null));
            pending = new ArrayList<>();
        }
        if (!pending.isEmpty()) {
            GoIdent last = pending.get(pending.size() - 1);
            throw this.error("missing parameter type", last.start, last.end);
        }
        return result;
    }

    List<GoField> typeParameters(@Nullable GoParser.TypeParametersContext context) {
        if (context == null)
            return new ArrayList<>();
        return Linq.map(context.typeParameterDecl(), d -> new GoField(this.start(d), this.end(d),
                this.identifiers(d.identifierList()), this.typeElement(d.typeElement()), null));
    }

    List<GoField> results(@Nullable GoParser.ResultContext context) {
        if (context == null)
            return new ArrayList<>();
        if (context.parameters() != null)
            return this.parameters(context.parameters());
        GoExpression type = this.type(context.type_());
        List<GoField> results = new ArrayList<>();
        results.add(new GoField(type.start, type.end, new ArrayList<>(), type, null));
        return results;
    }

    // Types

    GoExpression type(GoParser.Type_Context context) {
        if (context.typeName() != null)
            return this.instantiate(context, this.typeName(context.typeName()), context.typeArgs());
        if (context.typeLit() != null)
            return this.typeLit(context.typeLit());
        return new GoParenExpr(this.start(context), this.end(context), this.type(context.type_()));
    }

    GoExpression typeName(GoParser.TypeNameContext context) {
        GoIdent name = this.ident(context.IDENTIFIER(0));
        if (context.DOT() == null)
            return name;
        return new GoSelectorExpr(this.start(context), this.end(context), name, this.ident(context.IDENTIFIER(1)));
    }

    /** A generic type with its type arguments, List[int]. */
    GoExpression instantiate(ParserRuleContext context, GoExpression type,
                             @Nullable GoParser.TypeArgsContext arguments) {
        if (arguments == null)
            return type;
        return new GoIndexExpr(type.start, this.end(context), type, Linq.map(arguments.type_(), this::type));
    }

    GoExpression typeLit(GoParser.TypeLitContext context) {
        if (context.arrayType() != null)
            return this.arrayType(context.arrayType());
        if (context.structType() != null)
            return this.structType(context.structType());
        if (context.pointerType() != null)
            return new GoStarExpr(this.start(context), this.end(context),
                    this.type(context.pointerType().type_()));
        if (context.functionType() != null)
            return this.functionType(context.functionType());
        if (context.interfaceType() != null)
            return this.interfaceType(context.interfaceType());
        if (context.mapType() != null)
            return this.mapType(context.mapType());
        return this.channelType(context.channelType());
    }

    GoExpression typeOperand(GoParser.TypeOperandContext context) {
        if (context.arrayType() != null)
            return this.arrayType(context.arrayType());
        if (context.structType() != null)
            return this.structType(context.structType());
        if (context.mapType() != null)
            return this.mapType(context.mapType());
        if (context.channelType() != null)
            return this.channelType(context.channelType());
        if (context.interfaceType() != null)
            return this.interfaceType(context.interfaceType());
        return this.functionType(context.functionType());
    }

    GoArrayType arrayType(GoParser.ArrayTypeContext context) {
        GoExpression length = null;
        if (context.ELLIPSIS() != null)
            length = new GoEllipsis(this.start(context.ELLIPSIS()), this.end(context.ELLIPSIS()), null);
        else if (context.expression() != null)
            length = this.expression(context.expression());
        return new GoArrayType(this.start(context), this.end(context), length, this.type(context.type_()));
    }

    GoStructType structType(GoParser.StructTypeContext context) {
        return new GoStructType(this.start(context), this.end(context), this.start(context.L_CURLY()),
                Linq.map(context.fieldDecl(), this::fieldDecl));
    }

    GoField fieldDecl(GoParser.FieldDeclContext context) {
        GoBasicLit tag = context.tag == null ? null : this.string(context.tag);
        GoParser.EmbeddedFieldContext embedded = context.embeddedField();
        if (embedded == null)
            return new GoField(this.start(context), this.end(context),
                    this.identifiers(context.identifierList()), this.type(context.type_()), tag);
        GoExpression type = this.instantiate(embedded, this.typeName(embedded.typeName()), embedded.typeArgs());
        if (embedded.STAR() != null)
            type = new GoStarExpr(this.start(embedded), this.end(embedded), type);
        return new GoField(this.start(context), this.end(context), new ArrayList<>(), type, tag);
    }

    GoFuncType functionType(GoParser.FunctionTypeContext context) {
        GoParser.SignatureContext signature = context.signature();
        return new GoFuncType(this.start(context), this.end(context), new ArrayList<>(),
                this.parameters(signature.parameters()), this.results(signature.result()));
    }

    GoInterfaceType interfaceType(GoParser.InterfaceTypeContext context) {
        List<GoField> elements = new ArrayList<>();
        for (ParseTree child: context.children) {
            if (child instanceof GoParser.MethodSpecContext) {
                GoParser.MethodSpecContext method = (GoParser.MethodSpecContext) child;
                GoFuncType signature = new GoFuncType(this.start(method.parameters()), this.end(method),
                        new ArrayList<>(), this.parameters(method.parameters()), this.results(method.result()));
                elements.add(new GoField(this.start(method), this.end(method),
                        List.of(this.ident(method.IDENTIFIER())), signature, null));
            } else if (child instanceof GoParser.TypeElementContext) {
                GoParser.TypeElementContext element = (GoParser.TypeElementContext) child;
                elements.add(new GoField(this.start(element), this.end(element),
                        new ArrayList<>(), this.typeElement(element), null));
            }
        }
        return new GoInterfaceType(this.start(context), this.end(context), elements);
    }

    /** A union of terms such as ~int | ~string. */
    GoExpression typeElement(GoParser.TypeElementContext context) {
        List<GoParser.TypeTermContext> terms = context.typeTerm();
        GoExpression result = this.typeTerm(terms.get(0));
        for (int i = 1; i < terms.size(); i++)
            result = new GoBinaryExpr(this.start(context), this.end(terms.get(i)), "|",
                    result, this.typeTerm(terms.get(i)));
        return result;
    }

    GoExpression typeTerm(GoParser.TypeTermContext context) {
        GoExpression type = this.type(context.type_());
        if (context.UNDERLYING() == null)
            return type;
        return new GoUnaryExpr(this.start(context), this.end(context), "~", type);
    }

    GoMapType mapType(GoParser.MapTypeContext context) {
        return new GoMapType(this.start(context), this.end(context),
                this.type(context.type_(0)), this.type(context.type_(1)));
    }

    GoChanType channelType(GoParser.ChannelTypeContext context) {
        GoChanType.Direction direction = GoChanType.Direction.BOTH;
        if (context.getStart().getType() == GoLexer.RECEIVE)
            direction = GoChanType.Direction.RECEIVE;
        else if (context.RECEIVE() != null)
            direction = GoChanType.Direction.SEND;
        return new GoChanType(this.start(context), this.end(context), direction, this.type(context.type_()));
    }

    // Expressions

    GoExpression expression(GoParser.ExpressionContext context) {
        return (GoExpression) this.visit(context);
    }

    List<GoExpression> expressions(GoParser.ExpressionListContext context) {
        return Linq.map(context.expression(), this::expression);
    }

    @Override
    public GoExpression visitPrimaryExpression(GoParser.PrimaryExpressionContext context) {
        return (GoExpression) this.visit(context.primaryExpr());
    }

    @Override
    public GoExpression visitUnaryExpression(GoParser.UnaryExpressionContext context) {
        GoExpression operand = this.expression(context.expression());
        if (context.op.getType() == GoLexer.STAR)
            return new GoStarExpr(this.start(context), this.end(context), operand);
        return new GoUnaryExpr(this.start(context), this.end(context), context.op.getText(), operand);
    }

    @Override
    public GoExpression visitBinaryExpression(GoParser.BinaryExpressionContext context) {
        return new GoBinaryExpr(this.start(context), this.end(context), context.op.getText(),
                this.expression(context.expression(0)), this.expression(context.expression(1)));
    }

    @Override
    public GoExpression visitOperandExpression(GoParser.OperandExpressionContext context) {
        return this.operand(context.operand());
    }

    @Override
    public GoExpression visitSelectorExpression(GoParser.SelectorExpressionContext context) {
        return new GoSelectorExpr(this.start(context), this.end(context),
                (GoExpression) this.visit(context.primaryExpr()), this.ident(context.IDENTIFIER()));
    }

    @Override
    public GoExpression visitIndexExpression(GoParser.IndexExpressionContext context) {
        return new GoIndexExpr(this.start(context), this.end(context),
                (GoExpression) this.visit(context.primaryExpr()),
                Linq.map(context.expression(), this::expression));
    }

    @Override
    public GoExpression visitSliceExpression(GoParser.SliceExpressionContext context) {
        return new GoSliceExpr(this.start(context), this.end(context),
                (GoExpression) this.visit(context.primaryExpr()),
                context.low == null ? null : this.expression(context.low),
                context.high == null ? null : this.expression(context.high),
                context.max == null ? null : this.expression(context.max),
                context.COLON().size() == 2);
    }

    @Override
    public GoExpression visitTypeAssertion(GoParser.TypeAssertionContext context) {
        GoExpression type = context.TYPE() != null ? null : this.type(context.type_());
        return new GoTypeAssertExpr(this.start(context), this.end(context),
                (GoExpression) this.visit(context.primaryExpr()), type);
    }

    @Override
    public GoExpression visitCallExpression(GoParser.CallExpressionContext context) {
        GoParser.ArgumentsContext arguments = context.arguments();
        List<GoExpression> values = arguments.expressionList() == null
                ? new ArrayList<>() : this.expressions(arguments.expressionList());
        return new GoCallExpr(this.start(context), this.end(context),
                (GoExpression) this.visit(context.primaryExpr()), values, arguments.ELLIPSIS() != null);
    }

    GoExpression operand(GoParser.OperandContext context) {
        if (context.basicLit() != null)
            return this.basicLit(context.basicLit());
        if (context.compositeLit() != null)
            return this.compositeLit(context.compositeLit());
        if (context.functionLit() != null) {
            GoParser.FunctionLitContext function = context.functionLit();
            GoParser.SignatureContext signature = function.signature();
            GoFuncType type = new GoFuncType(this.start(function), this.end(signature), new ArrayList<>(),
                    this.parameters(signature.parameters()), this.results(signature.result()));
            return new GoFuncLit(this.start(function), this.end(function), type, this.block(function.block()));
        }
        if (context.IDENTIFIER() != null)
            return this.ident(context.IDENTIFIER());
        if (context.expression() != null)
            return new GoParenExpr(this.start(context), this.end(context), this.expression(context.expression()));
        return this.typeOperand(context.typeOperand());
    }

    GoBasicLit basicLit(GoParser.BasicLitContext context) {
        if (context.string_() != null)
            return this.string(context.string_());
        Token token = context.getStart();
        GoBasicLit.Kind kind = switch (token.getType()) {
            case GoLexer.FLOAT_LIT -> GoBasicLit.Kind.FLOAT;
            case GoLexer.IMAGINARY_LIT -> GoBasicLit.Kind.IMAG;
            case GoLexer.RUNE_LIT -> GoBasicLit.Kind.CHAR;
            default -> GoBasicLit.Kind.INT;
        };
        return new GoBasicLit(this.start(context), this.end(context), kind, token.getText());
    }

    GoBasicLit string(GoParser.String_Context context) {
        return new GoBasicLit(this.start(context), this.end(context), GoBasicLit.Kind.STRING, context.getText());
    }

    GoCompositeLit compositeLit(GoParser.CompositeLitContext context) {
        GoParser.LiteralTypeContext literalType = context.literalType();
        GoExpression type;
        if (literalType.structType() != null)
            type = this.structType(literalType.structType());
        else if (literalType.arrayType() != null)
            type = this.arrayType(literalType.arrayType());
        else if (literalType.mapType() != null)
            type = this.mapType(literalType.mapType());
        else
            type = this.instantiate(literalType, this.typeName(literalType.typeName()), literalType.typeArgs());
        return this.literalValue(context.literalValue(), type, this.start(context));
    }

    GoCompositeLit literalValue(GoParser.LiteralValueContext context, @Nullable GoExpression type, int start) {
        List<GoExpression> elements = new ArrayList<>();
        for (GoParser.KeyedElementContext element: context.keyedElement()) {
            GoExpression value = this.element(element.value);
            if (element.key != null)
                value = new GoKeyValueExpr(this.start(element), this.end(element), this.element(element.key), value);
            elements.add(value);
        }
        return new GoCompositeLit(start, this.end(context), type, this.start(context.L_CURLY()), elements);
    }

    GoExpression element(GoParser.ElementContext context) {
        if (context.expression() != null)
            return this.expression(context.expression());
        return this.literalValue(context.literalValue(), null, this.start(context));
    }

    // Statements

    GoBlockStmt block(GoParser.BlockContext context) {
        return new GoBlockStmt(this.start(context), this.end(context), this.statementList(context.statementList()));
    }

    List<GoStatement> statementList(GoParser.StatementListContext context) {
        return Linq.map(context.statement(), this::statement);
    }

    GoStatement statement(GoParser.StatementContext context) {
        int start = this.start(context);
        if (context.genDecl() != null)
            return new GoDeclStmt(this.genDecl(context.genDecl()));
        if (context.labeledStmt() != null)
            return this.labeledStmt(context.labeledStmt());
        if (context.simpleStmt() != null)
            return this.simpleStmt(context.simpleStmt());
        if (context.goStmt() != null)
            return new GoGoStmt(start, this.end(context), this.expression(context.goStmt().expression()));
        if (context.deferStmt() != null)
            return new GoDeferStmt(start, this.end(context), this.expression(context.deferStmt().expression()));
        if (context.returnStmt() != null) {
            GoParser.ExpressionListContext results = context.returnStmt().expressionList();
            return new GoReturnStmt(start, this.end(context),
                    results == null ? new ArrayList<>() : this.expressions(results));
        }
        if (context.branchStmt() != null) {
            GoParser.BranchStmtContext branch = context.branchStmt();
            GoIdent label = branch.IDENTIFIER() == null ? null : this.ident(branch.IDENTIFIER());
            return new GoBranchStmt(start, this.end(context), branch.keyword.getText(), label);
        }
        if (context.block() != null)
            return this.block(context.block());
        if (context.ifStmt() != null)
            return this.ifStmt(context.ifStmt());
        if (context.switchStmt() != null)
            return this.switchStmt(context.switchStmt());
        if (context.selectStmt() != null)
            return this.selectStmt(context.selectStmt());
        return this.forStmt(context.forStmt());
    }

    GoLabeledStmt labeledStmt(GoParser.LabeledStmtContext context) {
        GoIdent label = this.ident(context.IDENTIFIER());
        if (context.statement() == null) {
            int colon = this.end(context.COLON());
            return new GoLabeledStmt(this.start(context), colon, label, new GoEmptyStmt(colon, colon));
        }
        GoStatement statement = this.statement(context.statement());
        return new GoLabeledStmt(this.start(context), statement.end, label, statement);
    }

    GoStatement simpleStmt(GoParser.SimpleStmtContext context) {
        return (GoStatement) this.visit(context);
    }

    @Override
    public GoStatement visitSendStatement(GoParser.SendStatementContext context) {
        return new GoSendStmt(this.start(context), this.end(context),
                this.expression(context.expression(0)), this.expression(context.expression(1)));
    }

    @Override
    public GoStatement visitIncDecStatement(GoParser.IncDecStatementContext context) {
        return new GoIncDecStmt(this.start(context), this.end(context),
                this.expression(context.expression()), context.op.getText());
    }

    @Override
    public GoStatement visitAssignment(GoParser.AssignmentContext context) {
        return new GoAssignStmt(this.start(context), this.end(context),
                this.expressions(context.expressionList(0)), context.op.getText(),
                this.expressions(context.expressionList(1)));
    }

    @Override
    public GoStatement visitExpressionStatement(GoParser.ExpressionStatementContext context) {
        return new GoExprStmt(this.expression(context.expression()));
    }

    GoIfStmt ifStmt(GoParser.IfStmtContext context) {
        GoStatement init = context.init == null ? null : this.simpleStmt(context.init);
        GoStatement elseBranch = null;
        if (context.ifStmt() != null)
            elseBranch = this.ifStmt(context.ifStmt());
        else if (context.block().size() > 1)
            elseBranch = this.block(context.block(1));
        return new GoIfStmt(this.start(context), this.end(context), init,
                this.expression(context.expression()), this.block(context.block(0)), elseBranch);
    }

    /** True for 'x.(type)' and 'v := x.(type)', the headers of type switches. */
    static boolean isTypeSwitchGuard(@Nullable GoStatement statement) {
        if (statement == null)
            return false;
        GoExprStmt expression = statement.as(GoExprStmt.class);
        if (expression != null) {
            GoTypeAssertExpr assertion = expression.expression.as(GoTypeAssertExpr.class);
            return assertion != null && assertion.type == null;
        }
        GoAssignStmt assign = statement.as(GoAssignStmt.class);
        if (assign != null && assign.isDefinition() && assign.left.size() == 1 && assign.right.size() == 1) {
            GoTypeAssertExpr assertion = assign.right.get(0).as(GoTypeAssertExpr.class);
            return assertion != null && assertion.type == null;
        }
        return false;
    }

    GoExpression conditionOf(GoStatement statement) {
        GoExprStmt expression = statement.as(GoExprStmt.class);
        if (expression == null)
            throw this.error("cannot use " + statement + " as value", statement.start, statement.end);
        return expression.expression;
    }

    GoStatement switchStmt(GoParser.SwitchStmtContext context) {
        GoStatement init = context.init == null ? null : this.simpleStmt(context.init);
        GoStatement tag = context.tag == null ? null : this.simpleStmt(context.tag);
        List<GoCaseClause> clauses = Linq.map(context.caseClause(), this::caseClause);
        if (isTypeSwitchGuard(tag))
            return new GoTypeSwitchStmt(this.start(context), this.end(context), init, tag, clauses);
        GoExpression tagExpression = tag == null ? null : this.conditionOf(tag);
        return new GoSwitchStmt(this.start(context), this.end(context), init, tagExpression, clauses);
    }

    GoCaseClause caseClause(GoParser.CaseClauseContext context) {
        List<GoExpression> expressions = context.expressionList() == null
                ? new ArrayList<>() : this.expressions(context.expressionList());
        return new GoCaseClause(this.start(context), this.end(context), context.DEFAULT() != null,
                expressions, this.statementList(context.statementList()));
    }

    GoSelectStmt selectStmt(GoParser.SelectStmtContext context) {
        List<GoCommClause> clauses = new ArrayList<>();
        for (GoParser.CommClauseContext clause: context.commClause()) {
            GoStatement communication = clause.simpleStmt() == null ? null : this.simpleStmt(clause.simpleStmt());
            clauses.add(new GoCommClause(this.start(clause), this.end(clause), communication,
                    this.statementList(clause.statementList())));
        }
        return new GoSelectStmt(this.start(context), this.end(context), clauses);
    }

    GoStatement forStmt(GoParser.ForStmtContext context) {
        int start = this.start(context);
        int end = this.end(context);
        GoBlockStmt body = this.block(context.block());
        GoParser.RangeClauseContext range = context.rangeClause();
        if (range != null) {
            List<GoExpression> left = range.expressionList() == null
                    ? new ArrayList<>() : this.expressions(range.expressionList());
            if (left.size() > 2)
                throw this.error("expected at most 2 expressions", this.start(range), this.end(range));
            GoExpression key = left.isEmpty() ? null : left.get(0);
            GoExpression value = left.size() > 1 ? left.get(1) : null;
            String operator = range.op == null ? null : range.op.getText();
            return new GoRangeStmt(start, end, key, value, operator, this.expression(range.expression()), body);
        }
        GoParser.ForClauseContext clause = context.forClause();
        if (clause != null) {
            GoStatement init = clause.init == null ? null : this.simpleStmt(clause.init);
            GoExpression condition = clause.condition == null ? null : this.expression(clause.condition);
            GoStatement post = clause.post == null ? null : this.simpleStmt(clause.post);
            return new GoForStmt(start, end, init, condition, post, body);
        }
        GoExpression condition = context.expression() == null ? null : this.expression(context.expression());
        return new GoForStmt(start, end, null, condition, null, body);
    }
}
