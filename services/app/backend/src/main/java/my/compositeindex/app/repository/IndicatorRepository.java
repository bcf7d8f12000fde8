package my.compositeindex.app.repository;

import my.compositeindex.app.domain.Indicator;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface IndicatorRepository extends JpaRepository<Indicator, String> {
	@Query("select i from Indicator i order by i.key asc")
	List<Indicator> findAllOrderByKey();
}
