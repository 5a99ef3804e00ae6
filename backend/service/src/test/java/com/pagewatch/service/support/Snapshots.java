package com.pagewatch.service.support;

import com.pagewatch.core.model.ImageDescriptor;
import com.pagewatch.core.model.LinkDescriptor;
import com.pagewatch.core.model.PageSnapshot;

import java.time.Instant;
import java.util.List;

public final class Snapshots {
    public static final String URL = "https://acme.example/companies";
    private static final List<String> PARAGRAPHS = List.of(
            "Acme Robotics builds autonomous warehouse systems for retailers.",
            "The company was founded in 2019 and employs forty engineers."
    );

    private Snapshots() {
    }

    public static PageSnapshot base(Instant fetchedAt) {
        return PageSnapshot.of(
                URL,
                "Acme",
                PARAGRAPHS,
                List.of(ImageDescriptor.of("/img/hero.png", "Warehouse robot at work")),
                List.of(new LinkDescriptor("/careers", "Careers at Acme", "")),
                List.of("H1:Acme Robotics"),
                fetchedAt
        );
    }

    public static PageSnapshot withNewImage(Instant fetchedAt) {
        return PageSnapshot.of(
                URL,
                "Acme",
                PARAGRAPHS,
                List.of(
                        ImageDescriptor.of("/img/hero.png", "Warehouse robot at work"),
                        ImageDescriptor.of("/img/globex.png", "Globex Industries logo")
                ),
                List.of(new LinkDescriptor("/careers", "Careers at Acme", "")),
                List.of("H1:Acme Robotics"),
                fetchedAt
        );
    }
}
