package com.syntaxforge.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.syntaxforge.ast.BinaryExpression;
import com.syntaxforge.ast.CommentKind;
import com.syntaxforge.ast.DeclarationKind;
import com.syntaxforge.ast.ForLoop;
import com.syntaxforge.ast.GenericNode;
import com.syntaxforge.ast.IfStatement;
import com.syntaxforge.ast.Literal;
import com.syntaxforge.ast.MethodDeclaration;
import com.syntaxforge.ast.Node;
import com.syntaxforge.ast.NodeType;
import com.syntaxforge.ast.Range;
import com.syntaxforge.ast.ReturnStatement;
import com.syntaxforge.ast.SourceType;
import com.syntaxforge.ast.SwitchStatement;
import com.syntaxforge.ast.ThrowStatement;
import com.syntaxforge.ast.Visibility;
import com.syntaxforge.parser.ParseError;
import com.syntaxforge.parser.ParseResult;
import com.syntaxforge.parser.ParseWarning;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module that configures serialization for the AST classes.
 *
 * This module handles:
 * - Writing {@code type} as the first property of every node
 * - Proper null value handling for AST fields that can be null
 * - Ranges as two-element arrays and enums by their lower-case label
 * - Flattening {@link GenericNode} attributes into the node object
 * - Integral number output for literal values
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.syntaxforge", "syntaxforge-jackson"));
        addSerializer(Range.class, new RangeSerializer());
        addSerializer(GenericNode.class, new GenericNodeSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);

        context.setMixInAnnotations(Literal.class, LiteralMixin.class);
        context.setMixInAnnotations(MethodDeclaration.class, MethodDeclarationMixin.class);
        context.setMixInAnnotations(IfStatement.class, IfStatementMixin.class);
        context.setMixInAnnotations(ReturnStatement.class, ArgumentMixin.class);
        context.setMixInAnnotations(ThrowStatement.class, ArgumentMixin.class);
        context.setMixInAnnotations(ForLoop.class, ForLoopMixin.class);
        context.setMixInAnnotations(BinaryExpression.class, BinaryExpressionMixin.class);
        context.setMixInAnnotations(SwitchStatement.Case.class, CaseMixin.class);

        // Each enum gets the mixin directly; mixins on the shared interface are not consulted for enums
        context.setMixInAnnotations(CommentKind.class, LabeledMixin.class);
        context.setMixInAnnotations(DeclarationKind.class, LabeledMixin.class);
        context.setMixInAnnotations(Visibility.class, LabeledMixin.class);
        context.setMixInAnnotations(SourceType.class, LabeledMixin.class);
        context.setMixInAnnotations(NodeType.class, LabeledMixin.class);

        context.setMixInAnnotations(ParseError.class, DiagnosticMixin.class);
        context.setMixInAnnotations(ParseWarning.class, DiagnosticMixin.class);
        context.setMixInAnnotations(ParseResult.class, ParseResultMixin.class);
        context.setMixInAnnotations(Range.class, RangeMixin.class);

        context.addBeanSerializerModifier(new AstSerializerModifier());
    }

    // ==================== Serialization Mixins ====================

    @JsonPropertyOrder({"type", "loc", "range", "raw"})
    private abstract static class NodeMixin {
        @JsonProperty("type")
        abstract String type();
    }

    private abstract static class LiteralMixin {
        @JsonSerialize(using = LiteralValueSerializer.class)
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Object value();
    }

    private abstract static class MethodDeclarationMixin {
        @JsonProperty("static")
        abstract boolean isStatic();
    }

    private abstract static class IfStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Node alternate();
    }

    // ReturnStatement and ThrowStatement: a bare return or re-raise still writes "argument": null
    private abstract static class ArgumentMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Node argument();
    }

    private abstract static class ForLoopMixin {
        @JsonIgnore
        abstract boolean isForEach();
    }

    private abstract static class BinaryExpressionMixin {
        @JsonIgnore
        abstract boolean isLogical();
    }

    private abstract static class CaseMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Node test();

        @JsonIgnore
        abstract boolean isDefault();
    }

    private abstract static class LabeledMixin {
        @JsonValue
        abstract String label();
    }

    @JsonPropertyOrder({"severity", "message", "location"})
    private abstract static class DiagnosticMixin {
        @JsonProperty("severity")
        abstract String severity();
    }

    @JsonPropertyOrder({"ast", "errors", "warnings", "metadata"})
    private abstract static class ParseResultMixin {
        @JsonIgnore
        abstract boolean isSuccess();
    }

    private abstract static class RangeMixin {
        @JsonIgnore
        abstract int length();
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {

        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            if (!Node.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }

            // "type" always leads, whether or not the interface mixin was picked up
            List<BeanPropertyWriter> ordered = new ArrayList<>(beanProperties.size() + 1);
            BeanPropertyWriter type = null;
            for (BeanPropertyWriter prop : beanProperties) {
                if ("type".equals(prop.getName())) {
                    type = prop;
                } else {
                    ordered.add(prop);
                }
            }
            ordered.add(0, type != null ? type : new TypeBeanPropertyWriter());
            return ordered;
        }
    }

    /**
     * A property writer that adds 'type' to the JSON output by calling {@link Node#type()}.
     */
    private static class TypeBeanPropertyWriter extends BeanPropertyWriter {

        TypeBeanPropertyWriter() {
            super();
        }

        @Override
        public String getName() {
            return "type";
        }

        @Override
        public JavaType getType() {
            return TypeFactory.defaultInstance().constructType(String.class);
        }

        @Override
        public void serializeAsField(Object bean, JsonGenerator gen, SerializerProvider prov) throws Exception {
            gen.writeStringField("type", ((Node) bean).type());
        }
    }
}
