package com.questrail.fidl.ir;

import com.questrail.fidl.config.IrPathConfig;
import com.questrail.fidl.observability.BindingProtocolEvent;
import com.questrail.fidl.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class IrRegistryTest
{
    @Test
    void repeatedLoadsReturnTheSameInstance() {
        IrRegistry registry = IrFixtures.registry();
        assertFalse(registry.isLoaded("x"));

        IrLibrary first = registry.load("x");
        IrLibrary second = registry.load("x");

        assertSame(first, second);
        assertTrue(registry.isLoaded("x"));
        assertEquals("x", first.libraryName());
    }

    @Test
    void eachLibraryIsParsedOnce() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        IrRegistry registry = new IrRegistry(IrFixtures.config(), sink);

        registry.load("x");
        registry.load("x");
        registry.load("test.types");

        assertEquals(List.of(BindingProtocolEvent.Kind.LIBRARY_LOADED, BindingProtocolEvent.Kind.LIBRARY_LOADED),
                sink.getProtocolEventKinds());
    }

    @Test
    void missingLibraryNamesLibraryAndPath() {
        IrRegistry registry = IrFixtures.registry();

        LibraryNotFoundException e = assertThrows(LibraryNotFoundException.class,
                () -> registry.load("does.not.exist"));

        assertEquals("does.not.exist", e.library());
        assertTrue(e.getMessage().contains("does.not.exist"));
        assertTrue(e.getMessage().contains("does.not.exist.fidl.json"), e.getMessage());
        assertNotNull(e.searchedPath());
    }

    @Test
    void unconfiguredRootNamesTheConfigurationKeys() {
        IrRegistry registry = new IrRegistry(IrPathConfig.builder().build());

        LibraryNotFoundException e = assertThrows(LibraryNotFoundException.class, () -> registry.load("x"));

        assertTrue(e.getMessage().contains(IrPathConfig.IR_PATH_PROPERTY));
        assertTrue(e.getMessage().contains(IrPathConfig.IR_PATH_ENV));
    }

    @Test
    void malformedDocumentIsAFormatError(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.fidl.json");
        Files.writeString(file, "{ \"name\": ", StandardCharsets.UTF_8);
        IrRegistry registry = new IrRegistry(IrPathConfig.builder().withLibraryPath("broken", file).build());

        assertThrows(IrFormatException.class, () -> registry.load("broken"));
    }

    @Test
    void documentMustDeclareTheRequestedLibrary(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("other.fidl.json");
        Files.writeString(file, "{ \"name\": \"other\" }", StandardCharsets.UTF_8);
        IrRegistry registry = new IrRegistry(IrPathConfig.builder().withLibraryPath("expected", file).build());

        IrFormatException e = assertThrows(IrFormatException.class, () -> registry.load("expected"));
        assertTrue(e.getMessage().contains("expected"));
    }

    @Test
    void exposesDeclarationTablesInDeclarationOrder() {
        IrLibrary x = IrFixtures.registry().load("x");

        assertEquals(Optional.of("struct"), x.declarationKind("x/Point"));
        assertEquals(Optional.of("protocol"), x.declarationKind("x/Echo"));
        assertTrue(x.declarationKind("x/Missing").isEmpty());

        List<IrNode> structs = x.sortedDeclarations(DeclarationKind.STRUCT);
        assertEquals("x/Point", structs.get(0).rawName());
        assertEquals(5, structs.size());
        assertEquals(Optional.of("Echo test library."), x.documentation());
    }

    @Test
    void readsMethodFlags() {
        IrLibrary x = IrFixtures.registry().load("x");
        IrNode echo = x.declaration(DeclarationKind.PROTOCOL, "x/Echo").orElseThrow();

        IrMethod say = new IrMethod(echo.list("methods").get(0));
        assertEquals("Say", say.rawName());
        assertEquals(7410131367411424512L, say.ordinal());
        assertTrue(say.hasRequest());
        assertTrue(say.hasResponse());
        assertFalse(say.hasResult());
        assertEquals(Optional.of("x/EchoSayRequest"), say.requestPayloadIdentifier());

        IrMethod onHello = new IrMethod(echo.list("methods").get(4));
        assertFalse(onHello.hasRequest());
        assertTrue(onHello.requestPayload().isEmpty());
    }

    @Test
    void flexibleTwoWayMethodsHaveResults() {
        IrLibrary calc = IrFixtures.registry().load("test.calc");
        IrNode calculator = calc.declaration(DeclarationKind.PROTOCOL, "test.calc/Calculator").orElseThrow();

        IrMethod divide = new IrMethod(calculator.list("methods").get(0));
        IrMethod version = new IrMethod(calculator.list("methods").get(1));

        assertTrue(divide.hasResult());
        assertTrue(version.hasResult());
        assertEquals(Optional.of("test.calc/CalculatorVersionResult"),
                version.responsePayload().map(IrNode::identifier));
        assertEquals(Optional.of("test.calc/Calculator_Version_Result"), version.responsePayloadRawIdentifier());
    }
}
