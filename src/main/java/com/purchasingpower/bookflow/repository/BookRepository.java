package com.purchasingpower.bookflow.repository;

import com.purchasingpower.bookflow.model.store.Book;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the book catalog.
 *
 * Book resolution loads the catalog wholesale; keyword filtering happens in memory.
 */
@Repository
public interface BookRepository extends JpaRepository<Book, Long> {

    List<Book> findAllByOrderByIdAsc();
}
