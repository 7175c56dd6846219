package de.mirkosertic.ciexporter.schemas;

public record TestCase(String name, String classname, double executionTime, String status) {
}
