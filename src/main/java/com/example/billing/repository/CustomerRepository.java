package com.example.billing.repository;

import com.example.billing.domain.Customer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CustomerRepository extends JpaRepository<Customer, Long> {

    Optional<Customer> findByIdAndOwnerId(Long id, Long ownerId);

    List<Customer> findByOwnerIdOrderByCompanyNameAsc(Long ownerId);
}
