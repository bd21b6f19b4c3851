package com.purchasingpower.bookflow.entity;

import com.purchasingpower.bookflow.model.store.Book;
import lombok.Value;

import java.io.Serializable;

/**
 * Display summary of a book, returned alongside replies that list books.
 */
@Value
public class BookCard implements Serializable {

    private static final long serialVersionUID = 1L;

    Long id;
    String title;
    String author;
    double price;

    public static BookCard from(Book book) {
        return new BookCard(book.getId(), book.getTitle(), book.getAuthor(), book.getPrice());
    }
}
