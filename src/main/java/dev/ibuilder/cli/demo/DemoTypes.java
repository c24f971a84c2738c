package dev.ibuilder.cli.demo;

import dev.ibuilder.nodes.BoxNode;
import dev.ibuilder.nodes.NodeFactory;
import dev.ibuilder.nodes.OptionalNode;
import dev.ibuilder.nodes.RecordNode;
import dev.ibuilder.nodes.RecordNode.FieldOptions;
import dev.ibuilder.nodes.Scalars;
import dev.ibuilder.nodes.SequenceNode;
import dev.ibuilder.nodes.UnionNode;
import dev.ibuilder.nodes.UnionNode.VariantOptions;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Demo types and their node definitions.
 */
public final class DemoTypes {

    private DemoTypes() {}

    public record Example(long intField, String stringField, long defaulted) {}

    public enum Method { GET, POST, PUT, DELETE }

    public record Endpoint(String path, Method method, boolean authenticated) {}

    public sealed interface Auth {
        record Anonymous() implements Auth {}
        record Basic(String user, String password) implements Auth {}
        record Token(String token) implements Auth {}
    }

    public record ServerConfig(
        String host,
        int port,
        Optional<Path> certificate,
        List<Endpoint> endpoints,
        Auth auth,
        String version
    ) {}

    public record Tree(String label, List<Tree> children) {}

    public static NodeFactory<Example> example() {
        var builder = RecordNode.<Example>builder("Example");
        var intField = builder.field("int_field", Scalars.int64(),
            FieldOptions.<Long>defaults().prompt("This message is used as the help message of the field."));
        var stringField = builder.field("string_field", Scalars.string());
        var defaulted = builder.field("defaulted", Scalars.int64(), FieldOptions.withDefault(123L));
        return builder.build(v -> new Example(v.get(intField), v.get(stringField), v.get(defaulted)));
    }

    public static NodeFactory<ServerConfig> serverConfig() {
        var builder = RecordNode.<ServerConfig>builder("Server configuration")
            .prompt("What do you want to configure?");
        var host = builder.field("host", Scalars.string(), FieldOptions.withDefault("localhost"));
        var port = builder.field("port", Scalars.int32(), FieldOptions.withDefault(8080));
        var certificate = builder.field("certificate", OptionalNode.of(Scalars.path()),
            FieldOptions.<Optional<Path>>defaults().label("TLS certificate"));
        var endpoints = builder.field("endpoints", SequenceNode.of(endpoint()));
        var auth = builder.field("auth", auth(), FieldOptions.<Auth>defaults().label("authentication"));
        var version = builder.constant("version", "1");
        return builder.build(v -> new ServerConfig(v.get(host), v.get(port), v.get(certificate),
            v.get(endpoints), v.get(auth), v.get(version)));
    }

    static NodeFactory<Endpoint> endpoint() {
        var builder = RecordNode.<Endpoint>builder("Endpoint");
        var path = builder.field("path", Scalars.string());
        var method = builder.field("method", Scalars.scalar(Method::valueOf, "Type GET, POST, PUT or DELETE"),
            FieldOptions.withDefault(Method.GET));
        var authenticated = builder.field("authenticated", Scalars.bool(), FieldOptions.withDefault(true));
        return builder.build(v -> new Endpoint(v.get(path), v.get(method), v.get(authenticated)));
    }

    static NodeFactory<Auth> auth() {
        var basic = RecordNode.<Auth.Basic>builder("Basic");
        var user = basic.field("user", Scalars.string());
        var password = basic.field("password", Scalars.string());
        NodeFactory<Auth.Basic> basicFactory = basic.build(v -> new Auth.Basic(v.get(user), v.get(password)));

        return UnionNode.<Auth>builder("Auth")
            .prompt("How do clients authenticate?")
            .empty("Anonymous", new Auth.Anonymous(), VariantOptions.defaults().label("anonymous").asDefault())
            .variant("Basic", basicFactory, b -> b, VariantOptions.defaults().label("user and password"))
            .variant("Token", Scalars.string(), Auth.Token::new,
                VariantOptions.defaults().label("bearer token").prompt("Type the token"))
            .build();
    }

    private static NodeFactory<Tree> treeFactory;

    /** A self-referential type: the children are boxed so the definition can refer to itself. */
    public static synchronized NodeFactory<Tree> tree() {
        if (treeFactory == null) {
            var builder = RecordNode.<Tree>builder("Tree");
            var label = builder.field("label", Scalars.string());
            var children = builder.field("children", SequenceNode.of(BoxNode.lazy(DemoTypes::tree)));
            treeFactory = builder.build(v -> new Tree(v.get(label), v.get(children)));
        }
        return treeFactory;
    }
}
